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
@JsonTypeName("RESPOND_RESCHEDULE")
public class RespondRescheduleCommand implements ClaimCommand {

    private String actorId;
    private String listingId;
    private int seqNo;
    private boolean accept;

    @Override
    public CommandType type() {
        return CommandType.RESPOND_RESCHEDULE;
    }
}
