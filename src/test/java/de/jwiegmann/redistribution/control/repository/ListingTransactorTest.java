package de.jwiegmann.redistribution.control.repository;

import de.jwiegmann.redistribution.boundary.dto.error.ErrorCode;
import de.jwiegmann.redistribution.control.RedistributionErrorFactory;
import de.jwiegmann.redistribution.control.dto.MutationResult;
import de.jwiegmann.redistribution.control.dto.OperationResult;
import de.jwiegmann.redistribution.entity.Listing;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ListingTransactorTest {

    @Mock
    private AtomicStore<Listing> store;

    private ListingTransactor transactor(int maxAttempts) {
        return new ListingTransactor(store, maxAttempts, Duration.ZERO);
    }

    @SuppressWarnings("unchecked")
    private void storeReturns(Listing current, StoreResult<Listing>... outcomes) {
        var stubbing = when(store.transact(eq("l1"), any()));
        for (StoreResult<Listing> outcome : outcomes) {
            stubbing = stubbing.thenAnswer(inv -> {
                Function<Optional<Listing>, Optional<Listing>> fn = inv.getArgument(1);
                Optional<Listing> next = fn.apply(Optional.ofNullable(current));
                if (outcome.getOutcome() == StoreResult.Outcome.CONFLICT) {
                    return outcome;
                }
                return next.map(StoreResult::committed).orElseGet(StoreResult::aborted);
            });
        }
    }

    @Test
    void retriesWholeMutationAfterConflict() {
        Listing listing = Listing.builder().id("l1").totalQty(3).build();
        AtomicInteger calls = new AtomicInteger();
        storeReturns(listing, StoreResult.conflict(), StoreResult.conflict(), StoreResult.committed(null));

        OperationResult<Listing> result = transactor(5).execute("l1", l -> {
            calls.incrementAndGet();
            return MutationResult.commit();
        });

        assertThat(result.isSuccess()).isTrue();
        assertThat(calls).hasValue(3);
        assertThat(result.getValue().getUpdatedAt()).isNotNull();
    }

    @Test
    void givesUpWithContentionAfterMaxAttempts() {
        Listing listing = Listing.builder().id("l1").totalQty(3).build();
        storeReturns(listing, StoreResult.conflict(), StoreResult.conflict(), StoreResult.conflict());

        OperationResult<Listing> result = transactor(3).execute("l1", l -> MutationResult.commit());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.CONTENTION);
        assertThat(result.getError().getDetails()).containsEntry("attempts", 3);
        verify(store, times(3)).transact(eq("l1"), any());
    }

    @Test
    void skipReturnsUnchangedListing() {
        Listing listing = Listing.builder().id("l1").itemName("Gloves").totalQty(3).build();
        storeReturns(listing, StoreResult.committed(null));

        OperationResult<Listing> result = transactor(3).execute("l1", l -> MutationResult.skip());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().getItemName()).isEqualTo("Gloves");
        assertThat(result.getValue().getUpdatedAt()).isNull();
    }

    @Test
    void failurePassesErrorThrough() {
        Listing listing = Listing.builder().id("l1").totalQty(3).build();
        storeReturns(listing, StoreResult.committed(null));

        OperationResult<Listing> result = transactor(3).execute("l1",
                l -> MutationResult.fail(RedistributionErrorFactory.insufficientStock(4, 3)));

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INSUFFICIENT_STOCK);
        assertThat(result.getError().getDetails()).containsEntry("remaining", 3);
    }

    @Test
    void missingListingIsNotFound() {
        storeReturns(null, StoreResult.committed(null));

        OperationResult<Listing> result = transactor(3).execute("l1", l -> MutationResult.commit());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND);
    }
}
