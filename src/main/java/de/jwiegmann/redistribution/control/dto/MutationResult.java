package de.jwiegmann.redistribution.control.dto;

import de.jwiegmann.redistribution.boundary.dto.error.RedistributionError;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Entscheidung einer Listing-Mutation innerhalb einer Transaktion.
 * COMMIT schreibt die geänderte Kopie, SKIP ist ein Erfolg ohne Schreibvorgang, FAIL bricht ab.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MutationResult {

    public enum Decision {COMMIT, SKIP, FAIL}

    private Decision decision;
    private RedistributionError error;

    public static MutationResult commit() {
        return new MutationResult(Decision.COMMIT, null);
    }

    public static MutationResult skip() {
        return new MutationResult(Decision.SKIP, null);
    }

    public static MutationResult fail(RedistributionError error) {
        return new MutationResult(Decision.FAIL, error);
    }
}
