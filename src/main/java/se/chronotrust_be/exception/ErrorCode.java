package se.chronotrust_be.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {
    CONFLICT(HttpStatus.CONFLICT, true),
    INVALID_STATE(HttpStatus.UNPROCESSABLE_ENTITY, false),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, false),
    INVALID_AMOUNT(HttpStatus.BAD_REQUEST, false),
    INSUFFICIENT_FUNDS(HttpStatus.PAYMENT_REQUIRED, false),
    NO_EVALUATOR_AVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
    ALREADY_COMPLETED(HttpStatus.CONFLICT, false),
    CHAIN_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
    CHAIN_REJECTED(HttpStatus.UNPROCESSABLE_ENTITY, false),
    PAYMENT_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
    NOT_FOUND(HttpStatus.NOT_FOUND, false);

    private final HttpStatus httpStatus;
    private final boolean retryable;

    ErrorCode(HttpStatus httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }
}
