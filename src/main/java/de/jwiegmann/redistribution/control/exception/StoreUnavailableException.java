package de.jwiegmann.redistribution.control.exception;

import lombok.Getter;

/**
 * Unerwarteter, nicht fachlicher Fehler des Stores (z.B. Record nicht (de)serialisierbar).
 */
@Getter
public class StoreUnavailableException extends RuntimeException {

    private final String key;

    public StoreUnavailableException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }
}
