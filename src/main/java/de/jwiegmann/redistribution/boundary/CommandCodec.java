package de.jwiegmann.redistribution.boundary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.redistribution.boundary.dto.command.ClaimCommand;
import de.jwiegmann.redistribution.control.RedistributionErrorFactory;
import de.jwiegmann.redistribution.control.dto.OperationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * JSON-Kodierung der Kommandos für Button-Payloads, z.B.
 * {@code {"type":"APPROVE_CLAIM","actorId":"u1","listingId":"…","seqNo":2}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandCodec {

    private final ObjectMapper objectMapper;

    public String encode(ClaimCommand command) {
        try {
            return objectMapper.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("command " + command.type() + " is not serializable", e);
        }
    }

    /**
     * @return das Kommando, oder VALIDATION_FAILED für leere oder fehlerhafte Payloads
     */
    public OperationResult<ClaimCommand> decode(String payload) {
        if (payload == null || payload.isBlank()) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("empty command payload"));
        }

        try {
            ClaimCommand command = objectMapper.readValue(payload, ClaimCommand.class);
            if (command == null) {
                return OperationResult.failure(RedistributionErrorFactory.validationFailed("empty command payload"));
            }
            if (command.getListingId() == null || command.getActorId() == null) {
                return OperationResult.failure(RedistributionErrorFactory.validationFailed("actorId and listingId are required"));
            }
            return OperationResult.success(command);
        } catch (JsonProcessingException e) {
            log.warn("Malformed command payload: {}", e.getOriginalMessage());
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("malformed command payload"));
        }
    }
}
