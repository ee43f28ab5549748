package de.jwiegmann.redistribution.boundary;

import de.jwiegmann.redistribution.control.port.ClaimDecision;
import de.jwiegmann.redistribution.control.port.NotificationPort;
import de.jwiegmann.redistribution.entity.Claim;
import de.jwiegmann.redistribution.entity.Listing;
import lombok.extern.slf4j.Slf4j;

/**
 * Schreibt alle Benachrichtigungen ins Log. Die Post-Referenz ist "log:" + Listing-ID.
 */
@Slf4j
public class LoggingNotificationAdapter implements NotificationPort {

    static final String REF_PREFIX = "log:";

    @Override
    public void notifyOwnerNewClaim(Listing listing, Claim claim) {
        log.info("[owner {}] new claim #{} on '{}': {} by {} at '{}'", listing.getOwnerId(), claim.getSeqNo(),
                listing.getItemName(), claim.getQty(), claim.getClaimantId(), claim.getRequestedPickup());
    }

    @Override
    public void notifyClaimantDecision(Listing listing, Claim claim, ClaimDecision decision) {
        log.info("[claimant {}] claim #{} on '{}' {}", claim.getClaimantId(), claim.getSeqNo(),
                listing.getItemName(), decision);
    }

    @Override
    public void notifyClaimantRescheduleProposed(Listing listing, Claim claim, String proposedTime) {
        log.info("[claimant {}] owner proposes '{}' instead of '{}' for claim #{}", claim.getClaimantId(),
                proposedTime, claim.getRequestedPickup(), claim.getSeqNo());
    }

    @Override
    public void notifyOwnerRescheduleResponse(Listing listing, Claim claim, boolean accepted) {
        log.info("[owner {}] claimant {} {} the new time for claim #{}", listing.getOwnerId(),
                claim.getClaimantId(), accepted ? "accepted" : "declined", claim.getSeqNo());
    }

    @Override
    public void notifyOwnerClaimCancelled(Listing listing, Claim claim) {
        log.info("[owner {}] claim #{} on '{}' was cancelled", listing.getOwnerId(), claim.getSeqNo(),
                listing.getItemName());
    }

    @Override
    public String publishOrUpdateListingPost(Listing listing) {
        log.info("[post] '{}' {} of {} left, {}", listing.getItemName(), listing.getRemainingQty(),
                listing.getTotalQty(), listing.getStatus());
        return listing.getExternalRef() != null ? listing.getExternalRef() : REF_PREFIX + listing.getId();
    }

    @Override
    public void announceStillAvailable(Listing listing) {
        log.info("[post] still available: '{}' ({} left)", listing.getItemName(), listing.getRemainingQty());
    }
}
