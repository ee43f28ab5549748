package de.jwiegmann.redistribution.control;

import de.jwiegmann.redistribution.control.dto.MutationResult;
import de.jwiegmann.redistribution.control.dto.OperationResult;
import de.jwiegmann.redistribution.control.port.ClaimDecision;
import de.jwiegmann.redistribution.control.repository.ListingTransactor;
import de.jwiegmann.redistribution.entity.Claim;
import de.jwiegmann.redistribution.entity.ClaimHistoryEntry;
import de.jwiegmann.redistribution.entity.ClaimStatus;
import de.jwiegmann.redistribution.entity.Listing;
import de.jwiegmann.redistribution.entity.ListingStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Kern der Reconciliation: Claims einreichen, genehmigen, ablehnen und zurückziehen.
 * Jede Änderung läuft als eigene optimistische Transaktion über den {@link ListingTransactor};
 * Prüfungen werden bei einem Konflikt auf dem frisch gelesenen Listing wiederholt.
 * Offene Claims reservieren ihre Menge bis zur Entscheidung; Reject und Cancel geben sie wieder frei.
 * Genehmigt wird nach Ermessen des Owners, nicht in FIFO-Reihenfolge.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimEngine {

    private final ListingTransactor transactor;
    private final StockLedger stockLedger;
    private final NotificationService notificationService;

    /**
     * Reicht einen neuen Claim im Status PENDING ein.
     *
     * @param listingId    ID des Listings
     * @param claimantId   Identität des Anfragenden
     * @param claimantName Anzeigename, optional
     * @param qty          gewünschte Menge
     * @param pickupTime   vorgeschlagene Abholzeit (Freitext)
     * @return der angelegte Claim, oder NOT_FOUND / NOT_AVAILABLE / INVALID_QUANTITY /
     * INSUFFICIENT_STOCK / INVALID_STATE / VALIDATION_FAILED / CONTENTION
     */
    public OperationResult<Claim> submitClaim(String listingId, String claimantId, String claimantName,
                                              int qty, String pickupTime) {

        if (claimantId == null || claimantId.isBlank()) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("claimant is required"));
        }
        if (pickupTime == null || pickupTime.isBlank()) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("pickup time is required"));
        }

        OperationResult<Listing> result = transactor.execute(listingId, listing -> {

            // 1. Listing muss offen sein
            if (listing.getStatus() != ListingStatus.OPEN) {
                return MutationResult.fail(RedistributionErrorFactory.listingNotAvailable(listingId, listing.getStatus()));
            }

            // 2. Menge gegen verfügbaren Bestand prüfen (offene Claims reservieren)
            if (qty < 1) {
                return MutationResult.fail(RedistributionErrorFactory.invalidQuantity(String.valueOf(qty)));
            }
            int available = listing.getAvailableQty();
            if (qty > available) {
                return MutationResult.fail(RedistributionErrorFactory.insufficientStock(qty, available));
            }

            // 3. Nur eine offene Verhandlung pro (Listing, Claimant)
            var open = listing.findOpenClaimOf(claimantId);
            if (open.isPresent()) {
                return MutationResult.fail(RedistributionErrorFactory.openClaimExists(claimantId, open.get().getSeqNo()));
            }

            // 4. Claim anhängen
            LocalDateTime now = LocalDateTime.now();
            List<ClaimHistoryEntry> history = new ArrayList<>();
            history.add(ClaimHistoryEntry.builder().status(ClaimStatus.PENDING).at(now).build());

            listing.appendClaim(Claim.builder()
                    .claimantId(claimantId)
                    .claimantName(claimantName)
                    .qty(qty)
                    .requestedPickup(pickupTime.trim())
                    .status(ClaimStatus.PENDING)
                    .history(history)
                    .createdAt(now)
                    .build());
            return MutationResult.commit();
        });

        if (!result.isSuccess()) {
            log.info("Claim rejected: listing={}, claimant={}, qty={}, reason={}",
                    listingId, claimantId, qty, result.getErrorCode());
            return result.castFailure();
        }

        Listing listing = result.getValue();
        Claim claim = listing.getClaims().get(listing.getClaims().size() - 1);
        log.info("Claim submitted: listing={}, seqNo={}, claimant={}, qty={}, available={}",
                listingId, claim.getSeqNo(), claimantId, qty, listing.getAvailableQty());

        notificationService.newClaim(listing, claim);
        return OperationResult.success(claim);
    }

    /**
     * Genehmigt einen PENDING Claim. Ein zweiter Aufruf liefert INVALID_STATE.
     *
     * @return der genehmigte Claim, oder NOT_FOUND / INVALID_STATE / INSUFFICIENT_STOCK / CONTENTION
     */
    public OperationResult<Claim> approve(String listingId, int seqNo) {

        OperationResult<Listing> result = transactor.execute(listingId, listing -> {
            var found = listing.findClaim(seqNo);
            if (found.isEmpty()) {
                return MutationResult.fail(RedistributionErrorFactory.claimNotFound(listingId, seqNo));
            }
            Claim claim = found.get();
            if (claim.getStatus() != ClaimStatus.PENDING) {
                return MutationResult.fail(
                        RedistributionErrorFactory.invalidClaimState(seqNo, claim.getStatus(), ClaimStatus.PENDING));
            }
            return stockLedger.commit(listing, claim, ClaimStatus.APPROVED, LocalDateTime.now(), null);
        });

        if (!result.isSuccess()) {
            log.warn("Approval failed: listing={}, seqNo={}, reason={}", listingId, seqNo, result.getErrorCode());
            return result.castFailure();
        }

        Listing listing = result.getValue();
        Claim claim = listing.findClaim(seqNo).orElseThrow();
        log.info("Claim approved: listing={}, seqNo={}, qty={}, remaining={}, status={}",
                listingId, seqNo, claim.getQty(), listing.getRemainingQty(), listing.getStatus());

        notificationService.decision(listing, claim, ClaimDecision.APPROVED);
        notificationService.publish(listing);
        return OperationResult.success(claim);
    }

    /**
     * Lehnt einen PENDING Claim ab. Bereits entschiedene Claims sind unveränderlich.
     */
    public OperationResult<Claim> reject(String listingId, int seqNo) {

        OperationResult<Listing> result = transactor.execute(listingId, listing -> {
            var found = listing.findClaim(seqNo);
            if (found.isEmpty()) {
                return MutationResult.fail(RedistributionErrorFactory.claimNotFound(listingId, seqNo));
            }
            Claim claim = found.get();
            if (claim.getStatus() != ClaimStatus.PENDING) {
                return MutationResult.fail(
                        RedistributionErrorFactory.invalidClaimState(seqNo, claim.getStatus(), ClaimStatus.PENDING));
            }
            claim.transitionTo(ClaimStatus.REJECTED, LocalDateTime.now(), null);
            return MutationResult.commit();
        });

        if (!result.isSuccess()) {
            log.warn("Rejection failed: listing={}, seqNo={}, reason={}", listingId, seqNo, result.getErrorCode());
            return result.castFailure();
        }

        Listing listing = result.getValue();
        Claim claim = listing.findClaim(seqNo).orElseThrow();
        log.info("Claim rejected by owner: listing={}, seqNo={}", listingId, seqNo);

        notificationService.decision(listing, claim, ClaimDecision.REJECTED);
        return OperationResult.success(claim);
    }

    /**
     * Zieht einen offenen Claim zurück. Nur der ursprüngliche Claimant darf das, und nur solange
     * der Claim PENDING oder RESCHEDULE_PENDING ist.
     */
    public OperationResult<Claim> cancelByClaimant(String listingId, int seqNo, String claimantId) {

        OperationResult<Listing> result = transactor.execute(listingId, listing -> {
            var found = listing.findClaim(seqNo);
            if (found.isEmpty()) {
                return MutationResult.fail(RedistributionErrorFactory.claimNotFound(listingId, seqNo));
            }
            Claim claim = found.get();
            if (!claim.getClaimantId().equals(claimantId)) {
                return MutationResult.fail(RedistributionErrorFactory.notClaimant(seqNo, claimantId));
            }
            if (!claim.isOpen()) {
                return MutationResult.fail(RedistributionErrorFactory.claimNotOpen(seqNo, claim.getStatus()));
            }
            claim.transitionTo(ClaimStatus.CANCELLED, LocalDateTime.now(), null);
            return MutationResult.commit();
        });

        if (!result.isSuccess()) {
            log.warn("Cancellation failed: listing={}, seqNo={}, claimant={}, reason={}",
                    listingId, seqNo, claimantId, result.getErrorCode());
            return result.castFailure();
        }

        Listing listing = result.getValue();
        Claim claim = listing.findClaim(seqNo).orElseThrow();
        log.info("Claim cancelled by claimant: listing={}, seqNo={}", listingId, seqNo);

        notificationService.claimCancelled(listing, claim);
        return OperationResult.success(claim);
    }
}
