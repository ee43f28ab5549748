package de.jwiegmann.redistribution.entity;

/**
 * Schritte des linearen Intake-Flows. Jeder Schritt nimmt genau eine Antwort an.
 */
public enum IntakeStep {
    ITEM,
    QUANTITY,
    SIZE,
    EXPIRY,
    LOCATION,
    PHOTO,
    CONFIRM,
    COMMITTED,
    CANCELLED;

    /**
     * @return der nächste Schritt; CONFIRM und die Endzustände haben keinen Nachfolger
     */
    public IntakeStep next() {
        return switch (this) {
            case ITEM -> QUANTITY;
            case QUANTITY -> SIZE;
            case SIZE -> EXPIRY;
            case EXPIRY -> LOCATION;
            case LOCATION -> PHOTO;
            case PHOTO -> CONFIRM;
            case CONFIRM, COMMITTED, CANCELLED -> this;
        };
    }
}
