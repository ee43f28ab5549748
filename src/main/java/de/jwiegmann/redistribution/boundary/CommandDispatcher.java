package de.jwiegmann.redistribution.boundary;

import de.jwiegmann.redistribution.boundary.dto.command.ApproveClaimCommand;
import de.jwiegmann.redistribution.boundary.dto.command.CancelClaimCommand;
import de.jwiegmann.redistribution.boundary.dto.command.ClaimCommand;
import de.jwiegmann.redistribution.boundary.dto.command.ProposeRescheduleCommand;
import de.jwiegmann.redistribution.boundary.dto.command.RejectClaimCommand;
import de.jwiegmann.redistribution.boundary.dto.command.RespondRescheduleCommand;
import de.jwiegmann.redistribution.boundary.dto.command.SubmitClaimCommand;
import de.jwiegmann.redistribution.control.ClaimEngine;
import de.jwiegmann.redistribution.control.ListingRegistry;
import de.jwiegmann.redistribution.control.NegotiationStateMachine;
import de.jwiegmann.redistribution.control.RedistributionErrorFactory;
import de.jwiegmann.redistribution.control.dto.OperationResult;
import de.jwiegmann.redistribution.entity.Claim;
import de.jwiegmann.redistribution.entity.Listing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Einstiegspunkt für typisierte Kommandos des Chat-Transports.
 * Prüft, ob der Absender die Aktion ausführen darf, und leitet an die Zustandsautomaten weiter.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandDispatcher {

    private final ListingRegistry listingRegistry;
    private final ClaimEngine claimEngine;
    private final NegotiationStateMachine negotiation;

    /**
     * @return der betroffene Claim nach der Aktion, oder der Fehler der Aktion bzw. FORBIDDEN
     */
    public OperationResult<Claim> dispatch(ClaimCommand command) {
        if (command == null) {
            return OperationResult.failure(RedistributionErrorFactory.validationFailed("command missing"));
        }

        log.debug("Dispatching {} from {} on listing {}", command.type(), command.getActorId(), command.getListingId());

        return switch (command.type()) {
            case SUBMIT_CLAIM -> {
                SubmitClaimCommand c = (SubmitClaimCommand) command;
                yield claimEngine.submitClaim(c.getListingId(), c.getActorId(), c.getActorName(),
                        c.getQty(), c.getPickupTime());
            }
            case APPROVE_CLAIM -> {
                ApproveClaimCommand c = (ApproveClaimCommand) command;
                yield asOwner(c, () -> claimEngine.approve(c.getListingId(), c.getSeqNo()));
            }
            case REJECT_CLAIM -> {
                RejectClaimCommand c = (RejectClaimCommand) command;
                yield asOwner(c, () -> claimEngine.reject(c.getListingId(), c.getSeqNo()));
            }
            case PROPOSE_RESCHEDULE -> {
                ProposeRescheduleCommand c = (ProposeRescheduleCommand) command;
                yield asOwner(c, () -> negotiation.proposeNewTime(c.getListingId(), c.getSeqNo(), c.getProposedTime()));
            }
            case RESPOND_RESCHEDULE -> {
                RespondRescheduleCommand c = (RespondRescheduleCommand) command;
                yield asClaimant(c, c.getSeqNo(),
                        () -> negotiation.respondToReschedule(c.getListingId(), c.getSeqNo(), c.isAccept()));
            }
            case CANCEL_CLAIM -> {
                CancelClaimCommand c = (CancelClaimCommand) command;
                yield claimEngine.cancelByClaimant(c.getListingId(), c.getSeqNo(), c.getActorId());
            }
        };
    }

    // Owner eines Listings ändert sich nie, daher reicht die Prüfung außerhalb der Transaktion
    private OperationResult<Claim> asOwner(ClaimCommand command, Action action) {
        Optional<Listing> listing = listingRegistry.get(command.getListingId());
        if (listing.isEmpty()) {
            return OperationResult.failure(RedistributionErrorFactory.listingNotFound(command.getListingId()));
        }
        if (!listing.get().getOwnerId().equals(command.getActorId())) {
            log.warn("{} on listing {} rejected: {} is not the owner",
                    command.type(), command.getListingId(), command.getActorId());
            return OperationResult.failure(RedistributionErrorFactory.notOwner(command.getListingId(), command.getActorId()));
        }
        return action.run();
    }

    private OperationResult<Claim> asClaimant(ClaimCommand command, int seqNo, Action action) {
        Optional<Listing> listing = listingRegistry.get(command.getListingId());
        if (listing.isEmpty()) {
            return OperationResult.failure(RedistributionErrorFactory.listingNotFound(command.getListingId()));
        }
        Optional<Claim> claim = listing.get().findClaim(seqNo);
        if (claim.isEmpty()) {
            return OperationResult.failure(RedistributionErrorFactory.claimNotFound(command.getListingId(), seqNo));
        }
        if (!claim.get().getClaimantId().equals(command.getActorId())) {
            log.warn("{} on claim {}#{} rejected: {} is not the claimant",
                    command.type(), command.getListingId(), seqNo, command.getActorId());
            return OperationResult.failure(RedistributionErrorFactory.notClaimant(seqNo, command.getActorId()));
        }
        return action.run();
    }

    @FunctionalInterface
    private interface Action {
        OperationResult<Claim> run();
    }
}
