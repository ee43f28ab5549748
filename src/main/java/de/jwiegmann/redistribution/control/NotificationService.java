package de.jwiegmann.redistribution.control;

import de.jwiegmann.redistribution.control.dto.OperationResult;
import de.jwiegmann.redistribution.control.port.ClaimDecision;
import de.jwiegmann.redistribution.control.port.NotificationPort;
import de.jwiegmann.redistribution.entity.Claim;
import de.jwiegmann.redistribution.entity.Listing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ruft den {@link NotificationPort} nach committeten Übergängen auf.
 * Fehler des externen Transports werden geloggt und rollen den Zustand nicht zurück.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationPort notificationPort;
    private final ListingRegistry listingRegistry;

    public void newClaim(Listing listing, Claim claim) {
        deliver("new claim", listing, () -> notificationPort.notifyOwnerNewClaim(listing, claim));
    }

    public void decision(Listing listing, Claim claim, ClaimDecision decision) {
        deliver("decision " + decision, listing, () -> notificationPort.notifyClaimantDecision(listing, claim, decision));
    }

    public void rescheduleProposed(Listing listing, Claim claim, String proposedTime) {
        deliver("reschedule proposal", listing,
                () -> notificationPort.notifyClaimantRescheduleProposed(listing, claim, proposedTime));
    }

    public void rescheduleResponse(Listing listing, Claim claim, boolean accepted) {
        deliver("reschedule response", listing,
                () -> notificationPort.notifyOwnerRescheduleResponse(listing, claim, accepted));
    }

    public void claimCancelled(Listing listing, Claim claim) {
        deliver("cancellation", listing, () -> notificationPort.notifyOwnerClaimCancelled(listing, claim));
    }

    public boolean stillAvailable(Listing listing) {
        return deliver("bump", listing, () -> notificationPort.announceStillAvailable(listing));
    }

    /**
     * Veröffentlicht bzw. aktualisiert den öffentlichen Post und speichert beim ersten Mal
     * die zurückgegebene Referenz.
     *
     * @return das Listing inklusive externer Referenz (unverändert, wenn der Transport fehlschlägt)
     */
    public Listing publish(Listing listing) {
        String ref;
        try {
            ref = notificationPort.publishOrUpdateListingPost(listing);
        } catch (RuntimeException e) {
            log.error("Publishing listing {} failed", listing.getId(), e);
            return listing;
        }

        if (ref == null || listing.getExternalRef() != null) {
            return listing;
        }

        OperationResult<Listing> attached = listingRegistry.attachExternalRef(listing.getId(), ref);
        if (!attached.isSuccess()) {
            log.warn("Could not attach external ref {} to listing {}: {}",
                    ref, listing.getId(), attached.getError().getMessage());
            return listing;
        }
        return attached.getValue();
    }

    private boolean deliver(String what, Listing listing, Runnable call) {
        try {
            call.run();
            return true;
        } catch (RuntimeException e) {
            log.error("Sending {} notification for listing {} failed", what, listing.getId(), e);
            return false;
        }
    }
}
