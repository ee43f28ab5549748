package de.jwiegmann.redistribution.control;

import de.jwiegmann.redistribution.control.dto.OperationResult;
import de.jwiegmann.redistribution.entity.Listing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Administrative Aktionen: Erinnerungsposts für offene Listings und manuelles Ablaufen lassen.
 */
@Slf4j
@Service
public class AdminService {

    private final Set<String> adminUserIds;
    private final ListingRegistry listingRegistry;
    private final NotificationService notificationService;

    public AdminService(@Value("${redistribution.admin.user-ids:}") Set<String> adminUserIds,
                        ListingRegistry listingRegistry,
                        NotificationService notificationService) {
        this.adminUserIds = adminUserIds;
        this.listingRegistry = listingRegistry;
        this.notificationService = notificationService;
    }

    public boolean isAdmin(String userId) {
        return userId != null && adminUserIds.contains(userId);
    }

    /**
     * Kündigt jedes offene, bereits veröffentlichte Listing erneut an.
     *
     * @return Anzahl erfolgreich angekündigter Listings, oder FORBIDDEN
     */
    public OperationResult<Integer> bumpOpenListings(String actorId) {
        if (!isAdmin(actorId)) {
            log.warn("Bump requested by non-admin {}", actorId);
            return OperationResult.failure(RedistributionErrorFactory.notAdmin(actorId));
        }

        int bumped = 0;
        for (Listing listing : listingRegistry.findOpen()) {
            if (listing.getRemainingQty() > 0 && listing.getExternalRef() != null
                    && notificationService.stillAvailable(listing)) {
                bumped++;
            }
        }

        log.info("Bumped {} open listings on behalf of {}", bumped, actorId);
        return OperationResult.success(bumped);
    }

    /**
     * Lässt ein Listing ablaufen und aktualisiert den öffentlichen Post.
     * Vollständig vergebene Listings bleiben unverändert.
     */
    public OperationResult<Listing> expireListing(String actorId, String listingId) {
        if (!isAdmin(actorId)) {
            log.warn("Expiry of listing {} requested by non-admin {}", listingId, actorId);
            return OperationResult.failure(RedistributionErrorFactory.notAdmin(actorId));
        }

        OperationResult<Listing> expired = listingRegistry.markExpired(listingId);
        if (!expired.isSuccess()) {
            return expired;
        }
        return OperationResult.success(notificationService.publish(expired.getValue()));
    }
}
