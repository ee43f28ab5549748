package de.jwiegmann.redistribution.boundary.dto.command;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Owner schlägt für einen PENDING Claim eine andere Abholzeit vor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonTypeName("PROPOSE_RESCHEDULE")
public class ProposeRescheduleCommand implements ClaimCommand {

    private String actorId;
    private String listingId;
    private int seqNo;
    private String proposedTime;

    @Override
    public CommandType type() {
        return CommandType.PROPOSE_RESCHEDULE;
    }
}
