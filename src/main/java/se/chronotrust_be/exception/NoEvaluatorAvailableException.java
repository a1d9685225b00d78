package se.chronotrust_be.exception;

public class NoEvaluatorAvailableException extends LifecycleException {

    private static final long serialVersionUID = 1L;

    public NoEvaluatorAvailableException(String message) {
        super(ErrorCode.NO_EVALUATOR_AVAILABLE, message);
    }

    public NoEvaluatorAvailableException(String message, Throwable cause) {
        super(ErrorCode.NO_EVALUATOR_AVAILABLE, message, cause);
    }
}
