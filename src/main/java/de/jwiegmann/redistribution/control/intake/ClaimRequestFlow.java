package de.jwiegmann.redistribution.control.intake;

import de.jwiegmann.redistribution.boundary.dto.error.ErrorCode;
import de.jwiegmann.redistribution.control.ClaimEngine;
import de.jwiegmann.redistribution.control.ListingRegistry;
import de.jwiegmann.redistribution.control.RedistributionErrorFactory;
import de.jwiegmann.redistribution.control.dto.OperationResult;
import de.jwiegmann.redistribution.control.dto.ParsedQuantity;
import de.jwiegmann.redistribution.control.repository.DraftRepository;
import de.jwiegmann.redistribution.entity.Claim;
import de.jwiegmann.redistribution.entity.ClaimDraft;
import de.jwiegmann.redistribution.entity.ClaimDraftStep;
import de.jwiegmann.redistribution.entity.Listing;
import de.jwiegmann.redistribution.entity.ListingStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Claimant-seitiger Dialog: erst Menge, dann Abholzeit, danach Submit über die {@link ClaimEngine}.
 * Die Restmenge im Entwurf dient nur der frühen Rückmeldung; verbindlich ist die Prüfung beim Submit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimRequestFlow {

    private final DraftRepository<ClaimDraft> claimDraftRepository;
    private final DraftSessionPolicy sessionPolicy;
    private final IntakeFieldParser fieldParser;
    private final ListingRegistry listingRegistry;
    private final ClaimEngine claimEngine;

    /**
     * Startet eine Anfrage auf ein offenes Listing.
     *
     * @return der Entwurf mit der aktuell verfügbaren Menge, oder NOT_FOUND / NOT_AVAILABLE / INVALID_STATE /
     * INSUFFICIENT_STOCK / VALIDATION_FAILED
     */
    public OperationResult<ClaimDraft> begin(String userId, String userName, String listingId) {
        if (userId == null || userId.isBlank()) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("user is required"));
        }

        Optional<Listing> found = listingRegistry.get(listingId);
        if (found.isEmpty()) {
            return OperationResult.failure(RedistributionErrorFactory.listingNotFound(listingId));
        }
        Listing listing = found.get();

        if (listing.getStatus() != ListingStatus.OPEN) {
            return OperationResult.failure(RedistributionErrorFactory.listingNotAvailable(listingId, listing.getStatus()));
        }

        Optional<Claim> open = listing.findOpenClaimOf(userId);
        if (open.isPresent()) {
            return OperationResult.failure(RedistributionErrorFactory.openClaimExists(userId, open.get().getSeqNo()));
        }

        int available = listing.getAvailableQty();
        if (available < 1) {
            return OperationResult.failure(RedistributionErrorFactory.insufficientStock(1, available));
        }

        LocalDateTime now = LocalDateTime.now();
        ClaimDraft draft = ClaimDraft.builder()
                .userId(userId)
                .userName(userName)
                .listingId(listingId)
                .maxQty(available)
                .createdAt(now)
                .build();
        sessionPolicy.touch(draft, now);
        return OperationResult.success(claimDraftRepository.save(draft));
    }

    /**
     * Nimmt die gewünschte Menge entgegen.
     *
     * @return der Entwurf im Schritt PICKUP_TIME, oder INVALID_QUANTITY / INSUFFICIENT_STOCK
     */
    public OperationResult<ClaimDraft> answerQuantity(String userId, String text) {
        if (userId == null || userId.isBlank()) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("user is required"));
        }

        Optional<ClaimDraft> found = sessionPolicy.findActive(claimDraftRepository, userId);
        if (found.isEmpty()) {
            return OperationResult.failure(RedistributionErrorFactory.draftNotFound(userId));
        }
        ClaimDraft draft = found.get();

        if (draft.getStep() != ClaimDraftStep.QUANTITY) {
            return OperationResult.failure(RedistributionErrorFactory.unexpectedStep(draft.getStep().name()));
        }

        OperationResult<ParsedQuantity> parsed = fieldParser.parseQuantity(text);
        if (!parsed.isSuccess()) {
            return parsed.castFailure();
        }

        int qty = parsed.getValue().getValue();
        if (qty > draft.getMaxQty()) {
            return OperationResult.failure(RedistributionErrorFactory.insufficientStock(qty, draft.getMaxQty()));
        }

        draft.setQty(qty);
        draft.setStep(ClaimDraftStep.PICKUP_TIME);
        sessionPolicy.touch(draft, LocalDateTime.now());
        return OperationResult.success(claimDraftRepository.save(draft));
    }

    /**
     * Nimmt die Abholzeit entgegen und reicht den Claim ein. Der Entwurf wird danach verworfen,
     * außer bei einer leeren Abholzeit.
     */
    public OperationResult<Claim> answerPickupTime(String userId, String text) {
        if (userId == null || userId.isBlank()) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("user is required"));
        }

        Optional<ClaimDraft> found = sessionPolicy.findActive(claimDraftRepository, userId);
        if (found.isEmpty()) {
            return OperationResult.failure(RedistributionErrorFactory.draftNotFound(userId));
        }
        ClaimDraft draft = found.get();

        if (draft.getStep() != ClaimDraftStep.PICKUP_TIME) {
            return OperationResult.failure(RedistributionErrorFactory.unexpectedStep(draft.getStep().name()));
        }

        OperationResult<Claim> submitted = claimEngine.submitClaim(
                draft.getListingId(), userId, draft.getUserName(), draft.getQty(), text);

        if (submitted.getErrorCode() == ErrorCode.VALIDATION_FAILED) {
            return submitted;
        }
        claimDraftRepository.delete(userId);
        return submitted;
    }

    public OperationResult<ClaimDraft> cancel(String userId) {
        if (userId == null || userId.isBlank()) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("user is required"));
        }
        Optional<ClaimDraft> found = sessionPolicy.findActive(claimDraftRepository, userId);
        if (found.isEmpty()) {
            return OperationResult.failure(RedistributionErrorFactory.draftNotFound(userId));
        }
        claimDraftRepository.delete(userId);
        return OperationResult.success(found.get());
    }
}
