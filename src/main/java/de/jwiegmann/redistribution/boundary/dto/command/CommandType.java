package de.jwiegmann.redistribution.boundary.dto.command;

public enum CommandType {
    SUBMIT_CLAIM,
    APPROVE_CLAIM,
    REJECT_CLAIM,
    PROPOSE_RESCHEDULE,
    RESPOND_RESCHEDULE,
    CANCEL_CLAIM
}
