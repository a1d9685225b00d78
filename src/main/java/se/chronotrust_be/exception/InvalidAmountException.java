package se.chronotrust_be.exception;

public class InvalidAmountException extends LifecycleException {

    private static final long serialVersionUID = 1L;

    public InvalidAmountException(String message) {
        super(ErrorCode.INVALID_AMOUNT, message);
    }

    public InvalidAmountException(String message, Throwable cause) {
        super(ErrorCode.INVALID_AMOUNT, message, cause);
    }
}
