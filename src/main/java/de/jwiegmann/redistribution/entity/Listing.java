package de.jwiegmann.redistribution.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ein Angebot gespendeter Ware mit fester, nicht nachfüllbarer Menge.
 * Claims werden nur angehängt (Ankunftsreihenfolge), nie entfernt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Listing {

    private String id;
    private String ownerId;
    private String ownerName;

    // Beschreibende Felder (Freitext)
    private String itemName;
    private String quantityLabel;     // Originaleingabe, z.B. "10 bottles"
    private String sizeLabel;
    private String expiryLabel;
    private String locationLabel;
    private String photoRef;

    private int totalQty;

    @Builder.Default
    private List<Claim> claims = new ArrayList<>();

    @Builder.Default
    @Setter(AccessLevel.NONE)
    private ListingStatus status = ListingStatus.OPEN;

    private LocalDateTime expiredAt;  // gesetzt, wenn extern als veraltet markiert
    private String externalRef;       // Handle auf den öffentlichen Post, wird nur einmal gesetzt

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    /**
     * Summe der Mengen aller APPROVED / RESCHEDULE_ACCEPTED Claims.
     */
    @JsonIgnore
    public int getCommittedQty() {
        return claims.stream()
                .filter(Claim::isCommitted)
                .mapToInt(Claim::getQty)
                .sum();
    }

    /**
     * Committete Menge ohne den Claim mit der angegebenen seqNo.
     */
    public int committedQtyExcluding(int seqNo) {
        return claims.stream()
                .filter(c -> c.getSeqNo() != seqNo)
                .filter(Claim::isCommitted)
                .mapToInt(Claim::getQty)
                .sum();
    }

    @JsonIgnore
    public int getRemainingQty() {
        return totalQty - getCommittedQty();
    }

    /**
     * Summe der Mengen aller offenen (PENDING / RESCHEDULE_PENDING) Claims.
     */
    @JsonIgnore
    public int getReservedQty() {
        return claims.stream()
                .filter(Claim::isOpen)
                .mapToInt(Claim::getQty)
                .sum();
    }

    /**
     * Menge, die ein neuer Claim noch anfordern darf: weder committet noch durch offene Claims reserviert.
     */
    @JsonIgnore
    public int getAvailableQty() {
        return Math.max(0, totalQty - getCommittedQty() - getReservedQty());
    }

    public Optional<Claim> findClaim(int seqNo) {
        return claims.stream().filter(c -> c.getSeqNo() == seqNo).findFirst();
    }

    /**
     * Offener (PENDING / RESCHEDULE_PENDING) Claim eines Claimants, falls vorhanden.
     */
    public Optional<Claim> findOpenClaimOf(String claimantId) {
        return claims.stream()
                .filter(Claim::isOpen)
                .filter(c -> c.getClaimantId().equals(claimantId))
                .findFirst();
    }

    /**
     * Hängt einen neuen Claim an; seqNo ergibt sich aus der Ankunftsposition.
     */
    public Claim appendClaim(Claim claim) {
        claim.setSeqNo(claims.size() + 1);
        claims.add(claim);
        return claim;
    }

    /**
     * Leitet den Status aus Claims und Expiry ab. Vollständige Vergabe gewinnt gegen Expiry.
     */
    public ListingStatus refreshStatus() {
        if (getCommittedQty() >= totalQty) {
            status = ListingStatus.FULLY_COMMITTED;
        } else if (expiredAt != null) {
            status = ListingStatus.EXPIRED;
        } else {
            status = ListingStatus.OPEN;
        }
        return status;
    }
}
