package de.jwiegmann.redistribution.control.repository;

import de.jwiegmann.redistribution.control.RedistributionErrorFactory;
import de.jwiegmann.redistribution.control.dto.MutationResult;
import de.jwiegmann.redistribution.control.dto.OperationResult;
import de.jwiegmann.redistribution.entity.Listing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Optimistische Retry-Schleife um {@link AtomicStore#transact}: lesen, berechnen, committen,
 * bei Konflikt die gesamte Berechnung auf dem frisch gelesenen Listing wiederholen.
 * Nach {@code maxAttempts} Konflikten wird mit CONTENTION abgebrochen.
 */
@Slf4j
@Component
public class ListingTransactor {

    private final AtomicStore<Listing> listingStore;
    private final int maxAttempts;
    private final Duration backoff;

    public ListingTransactor(AtomicStore<Listing> listingStore,
                             @Value("${redistribution.store.max-attempts:5}") int maxAttempts,
                             @Value("${redistribution.store.backoff:PT0.005S}") Duration backoff) {
        this.listingStore = listingStore;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    /**
     * Führt die Mutation transaktional aus.
     *
     * @param listingId ID des Listings
     * @param mutation  Änderung auf einer Kopie des aktuellen Listings
     * @return das committete (bei SKIP das unveränderte) Listing oder den Fehler der Mutation,
     * NOT_FOUND bzw. CONTENTION
     */
    public OperationResult<Listing> execute(String listingId, ListingMutation mutation) {
        if (listingId == null) {
            return OperationResult.failure(RedistributionErrorFactory.listingNotFound(null));
        }

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {

            AtomicReference<MutationResult> decision = new AtomicReference<>();
            AtomicReference<Listing> unchanged = new AtomicReference<>();

            StoreResult<Listing> result = listingStore.transact(listingId, current -> {
                if (current.isEmpty()) {
                    decision.set(MutationResult.fail(RedistributionErrorFactory.listingNotFound(listingId)));
                    return Optional.empty();
                }

                Listing listing = current.get();
                MutationResult r = mutation.apply(listing);
                decision.set(r);

                return switch (r.getDecision()) {
                    case COMMIT -> {
                        listing.refreshStatus();
                        listing.setUpdatedAt(LocalDateTime.now());
                        yield Optional.of(listing);
                    }
                    case SKIP -> {
                        unchanged.set(listing);
                        yield Optional.empty();
                    }
                    case FAIL -> Optional.empty();
                };
            });

            switch (result.getOutcome()) {
                case COMMITTED -> {
                    return OperationResult.success(result.getValue());
                }
                case ABORTED -> {
                    MutationResult r = decision.get();
                    if (r.getDecision() == MutationResult.Decision.SKIP) {
                        return OperationResult.success(unchanged.get());
                    }
                    return OperationResult.failure(r.getError());
                }
                case CONFLICT -> {
                    log.debug("Optimistic conflict on listing {}, attempt {}/{}", listingId, attempt, maxAttempts);
                    if (attempt < maxAttempts && !pause(attempt)) {
                        return OperationResult.failure(RedistributionErrorFactory.contention(listingId, attempt));
                    }
                }
            }
        }

        log.warn("Giving up on listing {} after {} conflicting attempts", listingId, maxAttempts);
        return OperationResult.failure(RedistributionErrorFactory.contention(listingId, maxAttempts));
    }

    // Linearer Backoff; false bei Interrupt
    private boolean pause(int attempt) {
        try {
            Thread.sleep(backoff.multipliedBy(attempt).toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while backing off", e);
            return false;
        }
    }
}
