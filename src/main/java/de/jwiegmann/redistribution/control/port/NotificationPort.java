package de.jwiegmann.redistribution.control.port;

import de.jwiegmann.redistribution.entity.Claim;
import de.jwiegmann.redistribution.entity.Listing;

/**
 * Ausgehende Schnittstelle zu den Beteiligten. Implementiert vom Chat-Transport;
 * der Kern formatiert und versendet selbst keine Texte.
 */
public interface NotificationPort {

    /**
     * Informiert den Owner über einen neuen PENDING Claim.
     */
    void notifyOwnerNewClaim(Listing listing, Claim claim);

    void notifyClaimantDecision(Listing listing, Claim claim, ClaimDecision decision);

    /**
     * Schlägt dem Claimant eine neue Abholzeit vor. Die ursprüngliche Zeit steht in
     * {@link Claim#getRequestedPickup()}.
     */
    void notifyClaimantRescheduleProposed(Listing listing, Claim claim, String proposedTime);

    void notifyOwnerRescheduleResponse(Listing listing, Claim claim, boolean accepted);

    void notifyOwnerClaimCancelled(Listing listing, Claim claim);

    /**
     * Erstellt oder aktualisiert den öffentlichen Post (Restmenge bzw. geschlossen).
     *
     * @return Handle des Posts, wird beim ersten Publish am Listing gespeichert
     */
    String publishOrUpdateListingPost(Listing listing);

    /**
     * Erinnerungspost für ein noch verfügbares Listing.
     */
    void announceStillAvailable(Listing listing);
}
