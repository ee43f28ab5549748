package de.jwiegmann.redistribution.boundary.dto.error;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RedistributionError {
    private ErrorCode code;
    private String message;

    @Builder.Default
    private Map<String, Object> details = Map.of();

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    public RedistributionError(ErrorCode code, String message, Map<String, Object> details) {
        this.code = code;
        this.message = message;
        this.details = details;
        this.timestamp = LocalDateTime.now();
    }
}
