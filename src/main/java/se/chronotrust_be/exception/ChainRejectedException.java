package se.chronotrust_be.exception;

public class ChainRejectedException extends LifecycleException {

    private static final long serialVersionUID = 1L;

    public ChainRejectedException(String message) {
        super(ErrorCode.CHAIN_REJECTED, message);
    }

    public ChainRejectedException(String message, Throwable cause) {
        super(ErrorCode.CHAIN_REJECTED, message, cause);
    }
}
