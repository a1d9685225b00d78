package se.chronotrust_be.exception;

import lombok.Getter;

/**
 * Business-rule violation raised by the lifecycle services. Each subtype maps to exactly one
 * {@link ErrorCode}, which is what crosses the facade boundary.
 */
@Getter
public abstract class LifecycleException extends BusinessLogicException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;

    protected LifecycleException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LifecycleException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
