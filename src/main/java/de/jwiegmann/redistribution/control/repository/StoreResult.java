package de.jwiegmann.redistribution.control.repository;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StoreResult<V> {

    public enum Outcome {COMMITTED, CONFLICT, ABORTED}

    private Outcome outcome;
    private V value;

    public static <V> StoreResult<V> committed(V value) {
        return new StoreResult<>(Outcome.COMMITTED, value);
    }

    public static <V> StoreResult<V> conflict() {
        return new StoreResult<>(Outcome.CONFLICT, null);
    }

    public static <V> StoreResult<V> aborted() {
        return new StoreResult<>(Outcome.ABORTED, null);
    }
}
