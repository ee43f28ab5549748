package de.jwiegmann.redistribution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RedistributionApplication {

    public static void main(String[] args) {
        SpringApplication.run(RedistributionApplication.class, args);
    }
}
