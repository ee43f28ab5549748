package de.jwiegmann.redistribution.control;

import de.jwiegmann.redistribution.control.dto.MutationResult;
import de.jwiegmann.redistribution.control.dto.OperationResult;
import de.jwiegmann.redistribution.control.port.ClaimDecision;
import de.jwiegmann.redistribution.control.repository.ListingTransactor;
import de.jwiegmann.redistribution.entity.Claim;
import de.jwiegmann.redistribution.entity.ClaimStatus;
import de.jwiegmann.redistribution.entity.Listing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Reschedule-Verhandlung eines Claims:
 * PENDING → RESCHEDULE_PENDING → RESCHEDULE_ACCEPTED | RESCHEDULE_DECLINED.
 * Beide Übergänge sind gegen den Quellzustand abgesichert, damit veraltete Button-Klicks
 * einen bereits entschiedenen Claim nicht verändern.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NegotiationStateMachine {

    private final ListingTransactor transactor;
    private final StockLedger stockLedger;
    private final NotificationService notificationService;

    /**
     * Owner schlägt eine neue Abholzeit vor.
     *
     * @return der Claim im Status RESCHEDULE_PENDING, oder NOT_FOUND / INVALID_STATE / VALIDATION_FAILED
     */
    public OperationResult<Claim> proposeNewTime(String listingId, int seqNo, String newTime) {

        if (newTime == null || newTime.isBlank()) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("proposed time is required"));
        }
        String proposed = newTime.trim();

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
            claim.setProposedPickup(proposed);
            claim.transitionTo(ClaimStatus.RESCHEDULE_PENDING, LocalDateTime.now(), "proposed " + proposed);
            return MutationResult.commit();
        });

        if (!result.isSuccess()) {
            log.warn("Reschedule proposal failed: listing={}, seqNo={}, reason={}",
                    listingId, seqNo, result.getErrorCode());
            return result.castFailure();
        }

        Listing listing = result.getValue();
        Claim claim = listing.findClaim(seqNo).orElseThrow();
        log.info("Reschedule proposed: listing={}, seqNo={}, from='{}', to='{}'",
                listingId, seqNo, claim.getRequestedPickup(), proposed);

        notificationService.rescheduleProposed(listing, claim, proposed);
        return OperationResult.success(claim);
    }

    /**
     * Claimant beantwortet den Vorschlag. Annahme verhält sich wie ein Approve (gleiche
     * Bestandsprüfung) und ersetzt die Abholzeit; Ablehnung lässt den Bestand unverändert.
     *
     * @return der Claim im Status RESCHEDULE_ACCEPTED bzw. RESCHEDULE_DECLINED, oder
     * NOT_FOUND / INVALID_STATE / INSUFFICIENT_STOCK / CONTENTION
     */
    public OperationResult<Claim> respondToReschedule(String listingId, int seqNo, boolean accept) {

        OperationResult<Listing> result = transactor.execute(listingId, listing -> {
            var found = listing.findClaim(seqNo);
            if (found.isEmpty()) {
                return MutationResult.fail(RedistributionErrorFactory.claimNotFound(listingId, seqNo));
            }
            Claim claim = found.get();
            if (claim.getStatus() != ClaimStatus.RESCHEDULE_PENDING) {
                return MutationResult.fail(RedistributionErrorFactory.invalidClaimState(
                        seqNo, claim.getStatus(), ClaimStatus.RESCHEDULE_PENDING));
            }

            LocalDateTime now = LocalDateTime.now();
            if (!accept) {
                claim.transitionTo(ClaimStatus.RESCHEDULE_DECLINED, now, null);
                return MutationResult.commit();
            }

            String original = claim.getRequestedPickup();
            MutationResult committed = stockLedger.commit(listing, claim, ClaimStatus.RESCHEDULE_ACCEPTED, now,
                    "pickup changed from " + original);
            if (committed.getDecision() == MutationResult.Decision.COMMIT) {
                claim.setRequestedPickup(claim.getProposedPickup());
            }
            return committed;
        });

        if (!result.isSuccess()) {
            log.warn("Reschedule response failed: listing={}, seqNo={}, accept={}, reason={}",
                    listingId, seqNo, accept, result.getErrorCode());
            return result.castFailure();
        }

        Listing listing = result.getValue();
        Claim claim = listing.findClaim(seqNo).orElseThrow();

        if (accept) {
            log.info("Reschedule accepted: listing={}, seqNo={}, pickup='{}', remaining={}, status={}",
                    listingId, seqNo, claim.getRequestedPickup(), listing.getRemainingQty(), listing.getStatus());
            notificationService.decision(listing, claim, ClaimDecision.APPROVED);
            notificationService.rescheduleResponse(listing, claim, true);
            notificationService.publish(listing);
        } else {
            log.info("Reschedule declined: listing={}, seqNo={}", listingId, seqNo);
            notificationService.rescheduleResponse(listing, claim, false);
        }
        return OperationResult.success(claim);
    }
}
