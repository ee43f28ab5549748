package de.jwiegmann.redistribution.boundary;

import de.jwiegmann.redistribution.boundary.dto.command.ApproveClaimCommand;
import de.jwiegmann.redistribution.boundary.dto.command.CancelClaimCommand;
import de.jwiegmann.redistribution.boundary.dto.command.ProposeRescheduleCommand;
import de.jwiegmann.redistribution.boundary.dto.command.RejectClaimCommand;
import de.jwiegmann.redistribution.boundary.dto.command.RespondRescheduleCommand;
import de.jwiegmann.redistribution.boundary.dto.command.SubmitClaimCommand;
import de.jwiegmann.redistribution.boundary.dto.error.ErrorCode;
import de.jwiegmann.redistribution.control.RedistributionFixture;
import de.jwiegmann.redistribution.control.dto.OperationResult;
import de.jwiegmann.redistribution.control.port.NotificationPort;
import de.jwiegmann.redistribution.entity.Claim;
import de.jwiegmann.redistribution.entity.ClaimStatus;
import de.jwiegmann.redistribution.entity.Listing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class CommandDispatcherTest {

    private RedistributionFixture fx;
    private CommandDispatcher dispatcher;
    private Listing listing;

    @BeforeEach
    void setUp() {
        fx = new RedistributionFixture(mock(NotificationPort.class));
        dispatcher = new CommandDispatcher(fx.registry, fx.engine, fx.negotiation);
        listing = fx.listing("owner", "Towels", 4);
    }

    private Claim submitAs(String claimant, int qty) {
        OperationResult<Claim> result = dispatcher.dispatch(SubmitClaimCommand.builder()
                .actorId(claimant)
                .actorName(claimant.toUpperCase())
                .listingId(listing.getId())
                .qty(qty)
                .pickupTime("Mon")
                .build());
        assertThat(result.isSuccess()).isTrue();
        return result.getValue();
    }

    @Test
    void fullNegotiationThroughCommands() {
        Claim claim = submitAs("c1", 2);

        dispatcher.dispatch(ProposeRescheduleCommand.builder()
                .actorId("owner").listingId(listing.getId()).seqNo(claim.getSeqNo()).proposedTime("Tue").build());
        OperationResult<Claim> result = dispatcher.dispatch(RespondRescheduleCommand.builder()
                .actorId("c1").listingId(listing.getId()).seqNo(claim.getSeqNo()).accept(true).build());

        assertThat(result.getValue().getStatus()).isEqualTo(ClaimStatus.RESCHEDULE_ACCEPTED);
        assertThat(result.getValue().getClaimantName()).isEqualTo("C1");
        assertThat(fx.reload(listing).getRemainingQty()).isEqualTo(2);
    }

    @Nested
    @DisplayName("actor checks")
    class ActorChecks {

        @Test
        void onlyOwnerMayApproveOrReject() {
            Claim claim = submitAs("c1", 2);

            assertThat(dispatcher.dispatch(ApproveClaimCommand.builder()
                    .actorId("c1").listingId(listing.getId()).seqNo(claim.getSeqNo()).build()).getErrorCode())
                    .isEqualTo(ErrorCode.FORBIDDEN);
            assertThat(dispatcher.dispatch(RejectClaimCommand.builder()
                    .actorId("c2").listingId(listing.getId()).seqNo(claim.getSeqNo()).build()).getErrorCode())
                    .isEqualTo(ErrorCode.FORBIDDEN);

            assertThat(dispatcher.dispatch(ApproveClaimCommand.builder()
                    .actorId("owner").listingId(listing.getId()).seqNo(claim.getSeqNo()).build()).getValue().getStatus())
                    .isEqualTo(ClaimStatus.APPROVED);
        }

        @Test
        void onlyClaimantMayRespond() {
            Claim claim = submitAs("c1", 2);
            fx.negotiation.proposeNewTime(listing.getId(), claim.getSeqNo(), "Tue");

            assertThat(dispatcher.dispatch(RespondRescheduleCommand.builder()
                    .actorId("owner").listingId(listing.getId()).seqNo(claim.getSeqNo()).accept(true).build()).getErrorCode())
                    .isEqualTo(ErrorCode.FORBIDDEN);
        }

        @Test
        void onlyClaimantMayCancel() {
            Claim claim = submitAs("c1", 2);

            assertThat(dispatcher.dispatch(CancelClaimCommand.builder()
                    .actorId("owner").listingId(listing.getId()).seqNo(claim.getSeqNo()).build()).getErrorCode())
                    .isEqualTo(ErrorCode.FORBIDDEN);
            assertThat(dispatcher.dispatch(CancelClaimCommand.builder()
                    .actorId("c1").listingId(listing.getId()).seqNo(claim.getSeqNo()).build()).getValue().getStatus())
                    .isEqualTo(ClaimStatus.CANCELLED);
        }

        @Test
        void unknownTargetsAreNotFound() {
            assertThat(dispatcher.dispatch(ApproveClaimCommand.builder()
                    .actorId("owner").listingId("missing").seqNo(1).build()).getErrorCode())
                    .isEqualTo(ErrorCode.NOT_FOUND);
            assertThat(dispatcher.dispatch(RespondRescheduleCommand.builder()
                    .actorId("c1").listingId(listing.getId()).seqNo(9).build()).getErrorCode())
                    .isEqualTo(ErrorCode.NOT_FOUND);
            assertThat(dispatcher.dispatch(null).getErrorCode()).isEqualTo(ErrorCode.VALIDATION_FAILED);
        }
    }
}
