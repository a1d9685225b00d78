package se.chronotrust_be.dto.response;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import se.chronotrust_be.exception.ErrorCode;

import java.util.function.Function;

/**
 * Outcome of a lifecycle operation: either a value or an {@link ErrorCode} with a message.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationResult<T> {

    private final boolean success;
    private final T value;
    private final ErrorCode errorCode;
    private final String message;

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(true, value, null, null);
    }

    public static <T> OperationResult<T> failure(ErrorCode errorCode, String message) {
        return new OperationResult<>(false, null, errorCode, message);
    }

    public boolean isRetryable() {
        return !success && errorCode.isRetryable();
    }

    public <R> OperationResult<R> map(Function<? super T, ? extends R> mapper) {
        return success ? success(mapper.apply(value)) : failure(errorCode, message);
    }
}
