package com.purchasingpower.taskhub.api;

import com.purchasingpower.taskhub.exception.NoAvailableSourceException;
import com.purchasingpower.taskhub.exception.OperationTimeoutException;
import com.purchasingpower.taskhub.exception.RouterShuttingDownException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps storage failures to HTTP responses.
 *
 * <pre>
 * NoAvailableSource, RouterShuttingDown → 503
 * IllegalArgument                       → 400
 * OperationTimeout                      → 504
 * anything else                         → 500
 * </pre>
 */
@Slf4j
final class ErrorResponses {

    private ErrorResponses() {
    }

    static <T> ResponseEntity<ApiResponse<T>> from(String action, Throwable error) {
        Throwable cause = unwrap(error);
        HttpStatus status = statusOf(cause);

        if (status.is5xxServerError()) {
            log.error("{} failed: {}", action, cause.getMessage(), cause);
        } else {
            log.warn("{} rejected: {}", action, cause.getMessage());
        }
        return ResponseEntity.status(status).body(ApiResponse.error(action + " failed: " + cause.getMessage()));
    }

    static HttpStatus statusOf(Throwable cause) {
        if (cause instanceof NoAvailableSourceException || cause instanceof RouterShuttingDownException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (cause instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (cause instanceof OperationTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
