package com.blueprint.dispatch.api;

import com.blueprint.core.error.BlueprintException;
import com.blueprint.core.error.ConflictException;
import com.blueprint.core.error.GenerationException;
import com.blueprint.core.error.NotFoundException;
import com.blueprint.core.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Maps service errors to {@code {error, code, retryable}} JSON bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(BlueprintException.class)
    public ResponseEntity<Map<String, Object>> handleBlueprint(BlueprintException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", e.code(), e.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", e.code(), e.getMessage());
        }
        return body(status, e.getMessage(), e.code(), e.retryable());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return body(HttpStatus.BAD_REQUEST, "Malformed request body", "VALIDATION_ERROR", false);
    }

    @ExceptionHandler(CancellationException.class)
    public ResponseEntity<Map<String, Object>> handleCancelled(CancellationException e) {
        return body(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), "CANCELLED", true);
    }

    static HttpStatus statusFor(BlueprintException e) {
        if (e instanceof ValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof ConflictException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof GenerationException) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String code,
                                                            boolean retryable) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("code", code);
        body.put("retryable", retryable);
        return ResponseEntity.status(status).body(body);
    }
}
