package de.jwiegmann.redistribution.boundary.dto.command;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Eingehende Aktion eines Beteiligten, z.B. aus einem Button-Payload.
 * Auf dem Draht als JSON mit Diskriminator {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SubmitClaimCommand.class, name = "SUBMIT_CLAIM"),
        @JsonSubTypes.Type(value = ApproveClaimCommand.class, name = "APPROVE_CLAIM"),
        @JsonSubTypes.Type(value = RejectClaimCommand.class, name = "REJECT_CLAIM"),
        @JsonSubTypes.Type(value = ProposeRescheduleCommand.class, name = "PROPOSE_RESCHEDULE"),
        @JsonSubTypes.Type(value = RespondRescheduleCommand.class, name = "RESPOND_RESCHEDULE"),
        @JsonSubTypes.Type(value = CancelClaimCommand.class, name = "CANCEL_CLAIM")
})
public interface ClaimCommand {

    String getActorId();

    String getListingId();

    CommandType type();
}
