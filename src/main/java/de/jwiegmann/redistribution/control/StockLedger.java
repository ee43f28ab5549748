package de.jwiegmann.redistribution.control;

import de.jwiegmann.redistribution.control.dto.MutationResult;
import de.jwiegmann.redistribution.entity.Claim;
import de.jwiegmann.redistribution.entity.ClaimStatus;
import de.jwiegmann.redistribution.entity.Listing;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Bestandsprüfung beim Committen eines Claims. Wird von Approve und Reschedule-Accept
 * gemeinsam genutzt und läuft immer innerhalb einer Listing-Transaktion.
 */
@Component
public class StockLedger {

    /**
     * Committet den Claim, falls die übrigen committeten Mengen plus seine Menge die
     * Gesamtmenge nicht übersteigen.
     *
     * @param listing Kopie des Listings innerhalb der Transaktion
     * @param claim   der zu committende Claim dieses Listings
     * @param target  APPROVED oder RESCHEDULE_ACCEPTED
     * @return COMMIT oder FAIL mit INSUFFICIENT_STOCK
     */
    public MutationResult commit(Listing listing, Claim claim, ClaimStatus target, LocalDateTime now, String note) {
        if (!target.isCommitted()) {
            throw new IllegalArgumentException(target + " does not commit stock");
        }

        int committedByOthers = listing.committedQtyExcluding(claim.getSeqNo());
        int remaining = listing.getTotalQty() - committedByOthers;

        if (claim.getQty() > remaining) {
            return MutationResult.fail(RedistributionErrorFactory.insufficientStock(claim.getQty(), remaining));
        }

        claim.transitionTo(target, now, note);
        return MutationResult.commit();
    }
}
