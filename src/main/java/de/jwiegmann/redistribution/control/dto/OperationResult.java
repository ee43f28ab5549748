package de.jwiegmann.redistribution.control.dto;

import de.jwiegmann.redistribution.boundary.dto.error.ErrorCode;
import de.jwiegmann.redistribution.boundary.dto.error.RedistributionError;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.function.Function;

/**
 * Ergebnis einer Operation: entweder ein Wert oder ein {@link RedistributionError}.
 * Erwartbare Fehler (Race, Validierung) werden so als Wert zurückgegeben statt geworfen.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationResult<T> {

    private boolean success;
    private T value;
    private RedistributionError error;

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(true, value, null);
    }

    public static <T> OperationResult<T> failure(RedistributionError error) {
        return new OperationResult<>(false, null, error);
    }

    public ErrorCode getErrorCode() {
        return error != null ? error.getCode() : null;
    }

    /**
     * Überträgt den Fehler auf einen anderen Werttyp.
     */
    public <R> OperationResult<R> castFailure() {
        if (success) {
            throw new IllegalStateException("result is not a failure");
        }
        return failure(error);
    }

    public <R> OperationResult<R> map(Function<? super T, ? extends R> mapper) {
        return success ? success(mapper.apply(value)) : failure(error);
    }
}
