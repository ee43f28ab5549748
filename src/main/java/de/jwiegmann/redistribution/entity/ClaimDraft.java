package de.jwiegmann.redistribution.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Claimant-seitige Konversation: erst Menge, dann Abholzeit.
 * Der eigentliche Bestandscheck passiert erst transaktional beim Submit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimDraft implements UserDraft {

    private String userId;
    private String userName;
    private String listingId;

    @Builder.Default
    private ClaimDraftStep step = ClaimDraftStep.QUANTITY;

    private Integer qty;
    private int maxQty;         // Restmenge beim Start, nur zur frühen Rückmeldung

    private LocalDateTime createdAt;
    private LocalDateTime expiresAt;
}
