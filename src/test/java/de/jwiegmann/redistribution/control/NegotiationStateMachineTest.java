package de.jwiegmann.redistribution.control;

import de.jwiegmann.redistribution.boundary.dto.error.ErrorCode;
import de.jwiegmann.redistribution.control.dto.OperationResult;
import de.jwiegmann.redistribution.control.port.ClaimDecision;
import de.jwiegmann.redistribution.control.port.NotificationPort;
import de.jwiegmann.redistribution.entity.Claim;
import de.jwiegmann.redistribution.entity.ClaimHistoryEntry;
import de.jwiegmann.redistribution.entity.ClaimStatus;
import de.jwiegmann.redistribution.entity.Listing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NegotiationStateMachineTest {

    @Mock
    private NotificationPort port;

    private RedistributionFixture fx;
    private NegotiationStateMachine negotiation;
    private Listing listing;
    private Claim claim;

    @BeforeEach
    void setUp() {
        fx = new RedistributionFixture(port);
        negotiation = fx.negotiation;
        listing = fx.listing("owner", "Blankets", 5);
        claim = fx.submit(listing, "a", 3);
    }

    @Test
    void proposeStoresNewTimeAndNotifiesClaimant() {
        OperationResult<Claim> result = negotiation.proposeNewTime(listing.getId(), claim.getSeqNo(), "Fri 14:00");

        assertThat(result.getValue().getStatus()).isEqualTo(ClaimStatus.RESCHEDULE_PENDING);
        assertThat(result.getValue().getProposedPickup()).isEqualTo("Fri 14:00");
        assertThat(result.getValue().getRequestedPickup()).isEqualTo("Mon 10:00");
        verify(port).notifyClaimantRescheduleProposed(any(), any(), eq("Fri 14:00"));
    }

    @Test
    void acceptReplacesPickupAndCommitsStock() {
        negotiation.proposeNewTime(listing.getId(), claim.getSeqNo(), "Fri 14:00");

        OperationResult<Claim> result = negotiation.respondToReschedule(listing.getId(), claim.getSeqNo(), true);

        Claim accepted = result.getValue();
        assertThat(accepted.getStatus()).isEqualTo(ClaimStatus.RESCHEDULE_ACCEPTED);
        assertThat(accepted.getRequestedPickup()).isEqualTo("Fri 14:00");
        assertThat(accepted.getHistory()).extracting(ClaimHistoryEntry::getStatus)
                .containsExactly(ClaimStatus.PENDING, ClaimStatus.RESCHEDULE_PENDING, ClaimStatus.RESCHEDULE_ACCEPTED);
        assertThat(fx.reload(listing).getRemainingQty()).isEqualTo(2);

        verify(port).notifyClaimantDecision(any(), any(), eq(ClaimDecision.APPROVED));
        verify(port).notifyOwnerRescheduleResponse(any(), any(), eq(true));
        verify(port).publishOrUpdateListingPost(any());
    }

    @Test
    void declineLeavesCommittedQuantityUnchanged() {
        negotiation.proposeNewTime(listing.getId(), claim.getSeqNo(), "Fri 14:00");

        OperationResult<Claim> result = negotiation.respondToReschedule(listing.getId(), claim.getSeqNo(), false);

        assertThat(result.getValue().getStatus()).isEqualTo(ClaimStatus.RESCHEDULE_DECLINED);
        assertThat(fx.reload(listing).getCommittedQty()).isZero();
        verify(port).notifyOwnerRescheduleResponse(any(), any(), eq(false));
        verify(port, never()).publishOrUpdateListingPost(any());

        // Slot ist wieder frei, auch für denselben Claimant
        assertThat(fx.engine.submitClaim(listing.getId(), "a", "Anna", 3, "Sat").isSuccess()).isTrue();
    }

    @Test
    void acceptFailsWhenStockWasTakenMeanwhile() {
        Claim other = fx.seedPending(listing, "b", 3);
        negotiation.proposeNewTime(listing.getId(), claim.getSeqNo(), "Fri 14:00");
        fx.engine.approve(listing.getId(), other.getSeqNo());

        OperationResult<Claim> result = negotiation.respondToReschedule(listing.getId(), claim.getSeqNo(), true);

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INSUFFICIENT_STOCK);
        assertThat(result.getError().getDetails()).containsEntry("remaining", 2);
        assertThat(fx.reload(listing).findClaim(claim.getSeqNo()))
                .map(Claim::getStatus).contains(ClaimStatus.RESCHEDULE_PENDING);
    }

    @Test
    void stalePressesAreInvalidState() {
        // Antwort ohne Vorschlag
        assertThat(negotiation.respondToReschedule(listing.getId(), claim.getSeqNo(), true).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_STATE);

        fx.engine.approve(listing.getId(), claim.getSeqNo());

        // Vorschlag auf bereits genehmigten Claim
        assertThat(negotiation.proposeNewTime(listing.getId(), claim.getSeqNo(), "Fri").getErrorCode())
                .isEqualTo(ErrorCode.INVALID_STATE);
    }

    @Test
    void blankProposalIsRejected() {
        assertThat(negotiation.proposeNewTime(listing.getId(), claim.getSeqNo(), " ").getErrorCode())
                .isEqualTo(ErrorCode.VALIDATION_FAILED);
    }
}
