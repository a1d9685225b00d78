package se.chronotrust_be.exception;

public class AlreadyCompletedException extends LifecycleException {

    private static final long serialVersionUID = 1L;

    public AlreadyCompletedException(String message) {
        super(ErrorCode.ALREADY_COMPLETED, message);
    }

    public AlreadyCompletedException(String message, Throwable cause) {
        super(ErrorCode.ALREADY_COMPLETED, message, cause);
    }
}
