package se.chronotrust_be.util;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import se.chronotrust_be.dto.response.ApiResponse;
import se.chronotrust_be.dto.response.OperationResult;

/**
 * Renders an {@link OperationResult} as an HTTP response, taking the status from the error code.
 */
public class ResultResponses {

    private ResultResponses() {
    }

    public static <T> ResponseEntity<ApiResponse<T>> toResponse(OperationResult<T> result, String successMessage) {
        return toResponse(result, HttpStatus.OK, successMessage);
    }

    public static <T> ResponseEntity<ApiResponse<T>> toResponse(OperationResult<T> result, HttpStatus successStatus,
                                                                String successMessage) {
        if (result.isSuccess()) {
            return ResponseEntity.status(successStatus).body(ApiResponse.success(successMessage, result.getValue()));
        }
        return ResponseEntity.status(result.getErrorCode().getHttpStatus())
                .body(ApiResponse.error(result.getErrorCode().name(), result.getMessage(), result.isRetryable()));
    }
}
