package se.chronotrust_be.exception;

public class PaymentUnavailableException extends CollaboratorUnavailableException {

    private static final long serialVersionUID = 1L;

    public PaymentUnavailableException(String message) {
        super(ErrorCode.PAYMENT_UNAVAILABLE, message);
    }

    public PaymentUnavailableException(String message, Throwable cause) {
        super(ErrorCode.PAYMENT_UNAVAILABLE, message, cause);
    }
}
