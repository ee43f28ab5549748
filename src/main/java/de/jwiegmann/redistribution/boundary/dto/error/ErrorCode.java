package de.jwiegmann.redistribution.boundary.dto.error;

/**
 * Fehlertaxonomie aller Operationen.
 */
public enum ErrorCode {
    NOT_FOUND,            // Listing oder Claim unbekannt
    NOT_AVAILABLE,        // Listing nicht OPEN
    INVALID_STATE,        // Claim / Entwurf nicht im erwarteten Quellzustand
    INSUFFICIENT_STOCK,   // details.remaining
    INVALID_QUANTITY,
    INVALID_DATE,
    VALIDATION_FAILED,
    FORBIDDEN,            // falscher Akteur
    CONTENTION;           // Transaktions-Retries erschöpft

    /**
     * @return true, wenn der Nutzer die Anfrage später (ggf. angepasst) erneut stellen kann
     */
    public boolean isTransient() {
        return this == INSUFFICIENT_STOCK || this == CONTENTION;
    }
}
