package de.jwiegmann.redistribution.control.port;

public enum ClaimDecision {
    APPROVED,
    REJECTED
}
