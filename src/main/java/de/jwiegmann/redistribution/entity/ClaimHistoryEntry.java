package de.jwiegmann.redistribution.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Audit-Eintrag eines Claims: welcher Status wurde wann erreicht.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimHistoryEntry {

    private ClaimStatus status;
    private LocalDateTime at;
    private String note;      // optional, z.B. geänderte Abholzeit
}
