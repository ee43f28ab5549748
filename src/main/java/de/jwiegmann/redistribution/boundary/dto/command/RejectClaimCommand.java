package de.jwiegmann.redistribution.boundary.dto.command;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonTypeName("REJECT_CLAIM")
public class RejectClaimCommand implements ClaimCommand {

    private String actorId;
    private String listingId;
    private int seqNo;

    @Override
    public CommandType type() {
        return CommandType.REJECT_CLAIM;
    }
}
