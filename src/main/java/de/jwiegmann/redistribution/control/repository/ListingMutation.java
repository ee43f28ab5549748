package de.jwiegmann.redistribution.control.repository;

import de.jwiegmann.redistribution.control.dto.MutationResult;
import de.jwiegmann.redistribution.entity.Listing;

/**
 * Änderung eines Listings innerhalb einer Transaktion. Arbeitet auf einer Kopie, die bei
 * einem Konflikt verworfen und neu gelesen wird; muss daher ohne Seiteneffekte sein.
 */
@FunctionalInterface
public interface ListingMutation {

    MutationResult apply(Listing listing);
}
