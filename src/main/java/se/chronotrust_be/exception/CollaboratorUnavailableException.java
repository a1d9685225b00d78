package se.chronotrust_be.exception;

/**
 * Transient failure of an outbound collaborator (chain or payment). Callers retry these with the
 * same idempotency key; they are never dropped.
 */
public abstract class CollaboratorUnavailableException extends LifecycleException {

    private static final long serialVersionUID = 1L;

    protected CollaboratorUnavailableException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    protected CollaboratorUnavailableException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
