package de.jwiegmann.redistribution.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entwurf eines neuen Listings, gehört exklusiv der Intake-Session eines Nutzers.
 * Wird beim Commit, Abbruch oder Idle-Timeout verworfen.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntakeDraft implements UserDraft {

    private String userId;
    private String userName;

    @Builder.Default
    private IntakeStep step = IntakeStep.ITEM;

    private String itemName;
    private Integer totalQty;
    private String quantityLabel;
    private String sizeLabel;
    private String expiryLabel;
    private String locationLabel;
    private String photoRef;    // optional

    private LocalDateTime createdAt;
    private LocalDateTime expiresAt;
}
