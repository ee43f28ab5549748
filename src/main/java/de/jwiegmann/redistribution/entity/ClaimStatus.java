package de.jwiegmann.redistribution.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status eines Claims. Übergänge sind monoton, terminale Status werden nie wieder verlassen.
 */
public enum ClaimStatus {
    PENDING,
    APPROVED,
    REJECTED,
    RESCHEDULE_PENDING,
    RESCHEDULE_ACCEPTED,
    RESCHEDULE_DECLINED,
    CANCELLED;

    /**
     * @return true, wenn die Menge dieses Claims gegen den Bestand zählt
     */
    public boolean isCommitted() {
        return this == APPROVED || this == RESCHEDULE_ACCEPTED;
    }

    /**
     * @return true, solange Owner oder Claimant noch eine Entscheidung treffen können
     */
    public boolean isOpen() {
        return this == PENDING || this == RESCHEDULE_PENDING;
    }

    public boolean isTerminal() {
        return !isOpen();
    }

    public boolean canTransitionTo(ClaimStatus target) {
        return successors().contains(target);
    }

    private Set<ClaimStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(APPROVED, REJECTED, RESCHEDULE_PENDING, CANCELLED);
            case RESCHEDULE_PENDING -> EnumSet.of(RESCHEDULE_ACCEPTED, RESCHEDULE_DECLINED, CANCELLED);
            default -> EnumSet.noneOf(ClaimStatus.class);
        };
    }
}
