package de.jwiegmann.redistribution.config;

import de.jwiegmann.redistribution.boundary.LoggingNotificationAdapter;
import de.jwiegmann.redistribution.control.port.NotificationPort;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Fallback, solange kein Chat-Transport einen eigenen {@link NotificationPort} registriert.
 * Läuft als Auto-Configuration nach allen gescannten Beans, damit die Bedingung den Transport sieht.
 */
@AutoConfiguration
public class NotificationPortAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(NotificationPort.class)
    public NotificationPort notificationPort() {
        return new LoggingNotificationAdapter();
    }
}
