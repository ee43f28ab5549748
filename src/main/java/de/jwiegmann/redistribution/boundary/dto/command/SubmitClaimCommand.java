package de.jwiegmann.redistribution.boundary.dto.command;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Claimant fordert eine Teilmenge an.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonTypeName("SUBMIT_CLAIM")
public class SubmitClaimCommand implements ClaimCommand {

    private String actorId;
    private String listingId;
    private String actorName;
    private int qty;
    private String pickupTime;

    @Override
    public CommandType type() {
        return CommandType.SUBMIT_CLAIM;
    }
}
