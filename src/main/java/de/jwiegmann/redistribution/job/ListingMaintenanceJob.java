package de.jwiegmann.redistribution.job;

import de.jwiegmann.redistribution.control.ListingRegistry;
import de.jwiegmann.redistribution.control.NotificationService;
import de.jwiegmann.redistribution.control.dto.OperationResult;
import de.jwiegmann.redistribution.control.intake.DraftSessionPolicy;
import de.jwiegmann.redistribution.control.repository.DraftRepository;
import de.jwiegmann.redistribution.entity.ClaimDraft;
import de.jwiegmann.redistribution.entity.IntakeDraft;
import de.jwiegmann.redistribution.entity.Listing;
import de.jwiegmann.redistribution.entity.ListingStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

@Slf4j
@Component
public class ListingMaintenanceJob {

    private final DraftSessionPolicy sessionPolicy;
    private final DraftRepository<IntakeDraft> intakeDraftRepository;
    private final DraftRepository<ClaimDraft> claimDraftRepository;
    private final ListingRegistry listingRegistry;
    private final NotificationService notificationService;
    private final Duration maxAge;

    public ListingMaintenanceJob(DraftSessionPolicy sessionPolicy,
                                 DraftRepository<IntakeDraft> intakeDraftRepository,
                                 DraftRepository<ClaimDraft> claimDraftRepository,
                                 ListingRegistry listingRegistry,
                                 NotificationService notificationService,
                                 @Value("${redistribution.listing.max-age:P30D}") Duration maxAge) {
        this.sessionPolicy = sessionPolicy;
        this.intakeDraftRepository = intakeDraftRepository;
        this.claimDraftRepository = claimDraftRepository;
        this.listingRegistry = listingRegistry;
        this.notificationService = notificationService;
        this.maxAge = maxAge;
    }

    @Scheduled(fixedDelayString = "${redistribution.maintenance.interval:PT5M}",
            initialDelayString = "${redistribution.maintenance.interval:PT5M}")
    public void runMaintenance() {
        LocalDateTime now = LocalDateTime.now();
        int drafts = purgeIdleDrafts(now);
        int expired = expireStaleListings(now);

        if (drafts > 0 || expired > 0) {
            log.info("Maintenance completed: {} idle drafts purged, {} listings expired", drafts, expired);
        }
    }

    public int purgeIdleDrafts(LocalDateTime now) {
        return sessionPolicy.purgeExpired(intakeDraftRepository, now)
                + sessionPolicy.purgeExpired(claimDraftRepository, now);
    }

    /**
     * Lässt offene Listings ablaufen, die älter als {@code maxAge} sind, und aktualisiert ihren Post.
     */
    public int expireStaleListings(LocalDateTime now) {
        LocalDateTime cutoff = now.minus(maxAge);

        int expired = 0;
        for (Listing listing : listingRegistry.findOpen()) {
            if (listing.getCreatedAt() == null || !listing.getCreatedAt().isBefore(cutoff)) {
                continue;
            }

            OperationResult<Listing> result = listingRegistry.markExpired(listing.getId());
            if (!result.isSuccess()) {
                log.warn("Could not expire listing {}: {}", listing.getId(), result.getErrorCode());
                continue;
            }
            if (result.getValue().getStatus() == ListingStatus.EXPIRED) {
                notificationService.publish(result.getValue());
                expired++;
            }
        }
        return expired;
    }
}
