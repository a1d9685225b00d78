package se.chronotrust_be.exception;

public class InvalidStateException extends LifecycleException {

    private static final long serialVersionUID = 1L;

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(ErrorCode.INVALID_STATE, message, cause);
    }
}
