package de.jwiegmann.redistribution.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Anfrage eines Claimants auf einen Teil der Menge eines Listings.
 * Identifiziert über (listingId, seqNo); seqNo ist die 1-basierte Ankunftsposition im Listing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Claim {

    private int seqNo;
    private String claimantId;
    private String claimantName;
    private int qty;

    private String requestedPickup;
    private String proposedPickup;    // nur während/nach einem Reschedule

    private ClaimStatus status;

    @Builder.Default
    private List<ClaimHistoryEntry> history = new ArrayList<>();

    private LocalDateTime createdAt;

    /**
     * Führt einen Statusübergang durch und protokolliert ihn in der History.
     *
     * @throws IllegalStateException wenn der Übergang laut Zustandsautomat nicht erlaubt ist
     */
    public void transitionTo(ClaimStatus target, LocalDateTime at, String note) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("claim " + seqNo + " cannot move from " + status + " to " + target);
        }
        status = target;
        history.add(ClaimHistoryEntry.builder()
                .status(target)
                .at(at)
                .note(note)
                .build());
    }

    @JsonIgnore
    public boolean isCommitted() {
        return status != null && status.isCommitted();
    }

    @JsonIgnore
    public boolean isOpen() {
        return status != null && status.isOpen();
    }
}
