package se.chronotrust_be.exception;

public class ChainUnavailableException extends CollaboratorUnavailableException {

    private static final long serialVersionUID = 1L;

    public ChainUnavailableException(String message) {
        super(ErrorCode.CHAIN_UNAVAILABLE, message);
    }

    public ChainUnavailableException(String message, Throwable cause) {
        super(ErrorCode.CHAIN_UNAVAILABLE, message, cause);
    }
}
