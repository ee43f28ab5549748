package de.jwiegmann.redistribution.entity;

public enum ClaimDraftStep {
    QUANTITY,
    PICKUP_TIME
}
