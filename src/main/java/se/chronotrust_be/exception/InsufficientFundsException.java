package se.chronotrust_be.exception;

public class InsufficientFundsException extends LifecycleException {

    private static final long serialVersionUID = 1L;

    public InsufficientFundsException(String message) {
        super(ErrorCode.INSUFFICIENT_FUNDS, message);
    }

    public InsufficientFundsException(String message, Throwable cause) {
        super(ErrorCode.INSUFFICIENT_FUNDS, message, cause);
    }
}
