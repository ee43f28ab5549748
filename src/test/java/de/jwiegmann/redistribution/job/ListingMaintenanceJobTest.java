package de.jwiegmann.redistribution.job;

import de.jwiegmann.redistribution.control.RedistributionFixture;
import de.jwiegmann.redistribution.control.intake.DraftSessionPolicy;
import de.jwiegmann.redistribution.control.port.NotificationPort;
import de.jwiegmann.redistribution.control.repository.InMemoryClaimDraftRepository;
import de.jwiegmann.redistribution.control.repository.InMemoryIntakeDraftRepository;
import de.jwiegmann.redistribution.entity.ClaimDraft;
import de.jwiegmann.redistribution.entity.IntakeDraft;
import de.jwiegmann.redistribution.entity.Listing;
import de.jwiegmann.redistribution.entity.ListingStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ListingMaintenanceJobTest {

    @Mock
    private NotificationPort port;

    private RedistributionFixture fx;
    private InMemoryIntakeDraftRepository intakeDrafts;
    private InMemoryClaimDraftRepository claimDrafts;
    private ListingMaintenanceJob job;

    @BeforeEach
    void setUp() {
        fx = new RedistributionFixture(port);
        intakeDrafts = new InMemoryIntakeDraftRepository();
        claimDrafts = new InMemoryClaimDraftRepository();
        job = new ListingMaintenanceJob(new DraftSessionPolicy(Duration.ofMinutes(30)), intakeDrafts, claimDrafts,
                fx.registry, fx.notifications, Duration.ofDays(30));
    }

    @Test
    void purgesOnlyIdleDrafts() {
        LocalDateTime now = LocalDateTime.now();
        intakeDrafts.save(IntakeDraft.builder().userId("idle").expiresAt(now.minusMinutes(1)).build());
        intakeDrafts.save(IntakeDraft.builder().userId("active").expiresAt(now.plusMinutes(10)).build());
        claimDrafts.save(ClaimDraft.builder().userId("idle").expiresAt(now.minusSeconds(1)).build());

        assertThat(job.purgeIdleDrafts(now)).isEqualTo(2);

        assertThat(intakeDrafts.findAll()).extracting(IntakeDraft::getUserId).containsExactly("active");
        assertThat(claimDrafts.findAll()).isEmpty();
    }

    @Test
    void expiresOpenListingsOlderThanMaxAge() {
        Listing listing = fx.listing("owner", "Bread", 4);

        assertThat(job.expireStaleListings(LocalDateTime.now())).isZero();
        assertThat(job.expireStaleListings(LocalDateTime.now().plusDays(31))).isEqualTo(1);

        assertThat(fx.reload(listing).getStatus()).isEqualTo(ListingStatus.EXPIRED);
        assertThat(fx.reload(listing).getExpiredAt()).isNotNull();
        verify(port, times(1)).publishOrUpdateListingPost(any());
    }

    @Test
    void fullyCommittedListingsStayCommitted() {
        Listing listing = fx.listing("owner", "Bread", 4);
        fx.engine.approve(listing.getId(), fx.submit(listing, "a", 4).getSeqNo());

        assertThat(job.expireStaleListings(LocalDateTime.now().plusDays(31))).isZero();
        assertThat(fx.reload(listing).getStatus()).isEqualTo(ListingStatus.FULLY_COMMITTED);
    }
}
