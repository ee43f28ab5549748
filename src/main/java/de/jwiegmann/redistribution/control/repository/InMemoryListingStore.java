package de.jwiegmann.redistribution.control.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.redistribution.entity.Listing;
import org.springframework.stereotype.Repository;

/**
 * Listings als JSON-Records, Claims als geordnetes Array in Ankunftsreihenfolge.
 */
@Repository
public class InMemoryListingStore extends InMemoryAtomicStore<Listing> {

    public InMemoryListingStore(ObjectMapper objectMapper) {
        super(objectMapper, Listing.class);
    }
}
