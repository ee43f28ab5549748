package de.jwiegmann.redistribution;

import de.jwiegmann.redistribution.boundary.CommandCodec;
import de.jwiegmann.redistribution.boundary.CommandDispatcher;
import de.jwiegmann.redistribution.boundary.dto.command.ClaimCommand;
import de.jwiegmann.redistribution.boundary.dto.error.ErrorCode;
import de.jwiegmann.redistribution.control.AdminService;
import de.jwiegmann.redistribution.control.ListingRegistry;
import de.jwiegmann.redistribution.control.dto.OperationResult;
import de.jwiegmann.redistribution.control.intake.IntakeFlow;
import de.jwiegmann.redistribution.control.port.ClaimDecision;
import de.jwiegmann.redistribution.control.port.NotificationPort;
import de.jwiegmann.redistribution.entity.Claim;
import de.jwiegmann.redistribution.entity.Listing;
import de.jwiegmann.redistribution.entity.ListingStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = "redistribution.admin.user-ids=root,ops")
class RedistributionApplicationIntegrationTest {

    @Autowired
    private IntakeFlow intakeFlow;

    @Autowired
    private CommandCodec codec;

    @Autowired
    private CommandDispatcher dispatcher;

    @Autowired
    private ListingRegistry listingRegistry;

    @Autowired
    private AdminService adminService;

    @MockBean
    private NotificationPort notificationPort;

    private OperationResult<Claim> send(String json) {
        OperationResult<ClaimCommand> command = codec.decode(json);
        assertThat(command.isSuccess()).as(json).isTrue();
        return dispatcher.dispatch(command.getValue());
    }

    @Test
    void tenUnitScenarioOverButtonPayloads() {
        when(notificationPort.publishOrUpdateListingPost(any())).thenReturn("msg-1");

        // 1) Owner legt Listing mit 10 Einheiten an
        intakeFlow.start("owner", "Olga");
        for (String answer : new String[]{"Water", "10 bottles", "1.5L", "31/12/2099", "Ward 5", "skip"}) {
            assertThat(intakeFlow.answer("owner", answer).isSuccess()).isTrue();
        }
        Listing listing = intakeFlow.confirm("owner").getValue();
        String id = listing.getId();
        assertThat(listing.getExpiryLabel()).isEqualTo("31/12/99");
        assertThat(listing.getExternalRef()).isEqualTo("msg-1");

        // 2) A fordert 6 an, Owner genehmigt
        Claim a = send("""
                {"type":"SUBMIT_CLAIM","actorId":"a","actorName":"Anna","listingId":"%s","qty":6,"pickupTime":"Mon 10:00"}
                """.formatted(id)).getValue();
        send("""
                {"type":"APPROVE_CLAIM","actorId":"owner","listingId":"%s","seqNo":%d}
                """.formatted(id, a.getSeqNo()));
        assertThat(listingRegistry.get(id).orElseThrow().getRemainingQty()).isEqualTo(4);

        // 3) B will 5, bekommt INSUFFICIENT_STOCK(4)
        OperationResult<Claim> tooMuch = send("""
                {"type":"SUBMIT_CLAIM","actorId":"b","listingId":"%s","qty":5,"pickupTime":"Tue"}
                """.formatted(id));
        assertThat(tooMuch.getErrorCode()).isEqualTo(ErrorCode.INSUFFICIENT_STOCK);
        assertThat(tooMuch.getError().getDetails()).containsEntry("remaining", 4);

        // 4) B fordert 4 an, Owner schlägt neue Zeit vor, B nimmt an
        Claim b = send("""
                {"type":"SUBMIT_CLAIM","actorId":"b","listingId":"%s","qty":4,"pickupTime":"Tue"}
                """.formatted(id)).getValue();
        send("""
                {"type":"PROPOSE_RESCHEDULE","actorId":"owner","listingId":"%s","seqNo":%d,"proposedTime":"Wed 9:00"}
                """.formatted(id, b.getSeqNo()));
        Claim accepted = send("""
                {"type":"RESPOND_RESCHEDULE","actorId":"b","listingId":"%s","seqNo":%d,"accept":true}
                """.formatted(id, b.getSeqNo())).getValue();

        assertThat(accepted.getRequestedPickup()).isEqualTo("Wed 9:00");
        Listing stored = listingRegistry.get(id).orElseThrow();
        assertThat(stored.getRemainingQty()).isZero();
        assertThat(stored.getStatus()).isEqualTo(ListingStatus.FULLY_COMMITTED);

        verify(notificationPort, times(2)).notifyClaimantDecision(any(), any(), eq(ClaimDecision.APPROVED));
        // Intake, Approve, Reschedule-Accept
        verify(notificationPort, times(3)).publishOrUpdateListingPost(any());
    }

    @Test
    void adminIdsComeFromConfiguration() {
        assertThat(adminService.isAdmin("ops")).isTrue();
        assertThat(adminService.isAdmin("owner")).isFalse();
    }
}
