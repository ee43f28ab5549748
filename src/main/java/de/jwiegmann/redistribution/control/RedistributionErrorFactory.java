package de.jwiegmann.redistribution.control;

import de.jwiegmann.redistribution.boundary.dto.error.ErrorCode;
import de.jwiegmann.redistribution.boundary.dto.error.RedistributionError;
import de.jwiegmann.redistribution.entity.ClaimStatus;
import de.jwiegmann.redistribution.entity.ListingStatus;

import java.util.Map;

public final class RedistributionErrorFactory {

    private RedistributionErrorFactory() {
    }

    public static RedistributionError listingNotFound(String listingId) {
        return RedistributionError.builder()
                .code(ErrorCode.NOT_FOUND)
                .message("listing not found")
                .details(Map.of("listingId", String.valueOf(listingId)))
                .build();
    }

    public static RedistributionError claimNotFound(String listingId, int seqNo) {
        return RedistributionError.builder()
                .code(ErrorCode.NOT_FOUND)
                .message("claim not found")
                .details(Map.of("listingId", listingId, "seqNo", seqNo))
                .build();
    }

    public static RedistributionError draftNotFound(String userId) {
        return RedistributionError.builder()
                .code(ErrorCode.NOT_FOUND)
                .message("no conversation in progress")
                .details(Map.of("userId", String.valueOf(userId)))
                .build();
    }

    public static RedistributionError listingNotAvailable(String listingId, ListingStatus status) {
        return RedistributionError.builder()
                .code(ErrorCode.NOT_AVAILABLE)
                .message("listing is not open for claims")
                .details(Map.of("listingId", listingId, "status", status.name()))
                .build();
    }

    public static RedistributionError invalidClaimState(int seqNo, ClaimStatus actual, ClaimStatus expected) {
        return RedistributionError.builder()
                .code(ErrorCode.INVALID_STATE)
                .message("claim already handled")
                .details(Map.of("seqNo", seqNo, "status", actual.name(), "expected", expected.name()))
                .build();
    }

    public static RedistributionError claimNotOpen(int seqNo, ClaimStatus actual) {
        return RedistributionError.builder()
                .code(ErrorCode.INVALID_STATE)
                .message("claim is no longer open")
                .details(Map.of("seqNo", seqNo, "status", actual.name()))
                .build();
    }

    public static RedistributionError openClaimExists(String claimantId, int seqNo) {
        return RedistributionError.builder()
                .code(ErrorCode.INVALID_STATE)
                .message("claimant already has an open claim on this listing")
                .details(Map.of("claimantId", claimantId, "seqNo", seqNo))
                .build();
    }

    public static RedistributionError unexpectedStep(String step) {
        return RedistributionError.builder()
                .code(ErrorCode.INVALID_STATE)
                .message("answer not expected in this step")
                .details(Map.of("step", step))
                .build();
    }

    public static RedistributionError insufficientStock(int requested, int remaining) {
        return RedistributionError.builder()
                .code(ErrorCode.INSUFFICIENT_STOCK)
                .message("only " + remaining + " units remaining")
                .details(Map.of("requested", requested, "remaining", remaining))
                .build();
    }

    public static RedistributionError invalidQuantity(String input) {
        return RedistributionError.builder()
                .code(ErrorCode.INVALID_QUANTITY)
                .message("quantity must contain a positive number")
                .details(Map.of("input", String.valueOf(input)))
                .build();
    }

    public static RedistributionError invalidDate(String input) {
        return RedistributionError.builder()
                .code(ErrorCode.INVALID_DATE)
                .message("invalid date, use DD/MM/YYYY or 'na'")
                .details(Map.of("input", String.valueOf(input)))
                .build();
    }

    public static RedistributionError validationFailed(String details) {
        return RedistributionError.builder()
                .code(ErrorCode.VALIDATION_FAILED)
                .message("validation failed: " + details)
                .details(Map.of("details", details))
                .build();
    }

    public static RedistributionError notOwner(String listingId, String actorId) {
        return RedistributionError.builder()
                .code(ErrorCode.FORBIDDEN)
                .message("only the listing owner may do this")
                .details(Map.of("listingId", listingId, "actorId", String.valueOf(actorId)))
                .build();
    }

    public static RedistributionError notClaimant(int seqNo, String actorId) {
        return RedistributionError.builder()
                .code(ErrorCode.FORBIDDEN)
                .message("only the claimant may do this")
                .details(Map.of("seqNo", seqNo, "actorId", String.valueOf(actorId)))
                .build();
    }

    public static RedistributionError notAdmin(String actorId) {
        return RedistributionError.builder()
                .code(ErrorCode.FORBIDDEN)
                .message("admin only")
                .details(Map.of("actorId", String.valueOf(actorId)))
                .build();
    }

    public static RedistributionError contention(String listingId, int attempts) {
        return RedistributionError.builder()
                .code(ErrorCode.CONTENTION)
                .message("listing is busy, please retry")
                .details(Map.of("listingId", listingId, "attempts", attempts))
                .build();
    }
}
