package com.creditledger.controller;

import com.creditledger.result.LendingError;
import com.creditledger.result.LendingResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.Map;
import java.util.function.Function;

/**
 * Maps ledger results onto HTTP responses.
 *
 * Error kind       | Status
 * -----------------|-----------------------
 * NOT_FOUND        | 404
 * ALREADY_EXISTS   | 409
 * INVALID_AMOUNT   | 400
 * INSUFFICIENT_SCORE | 422
 * UNAUTHORIZED     | 403
 * INVALID_PARAMETERS | 400
 */
final class LendingResponses {

    private LendingResponses() {
    }

    static <T> ResponseEntity<Object> toResponse(LendingResult<T> result, Function<? super T, ?> body) {
        if (result.isOk()) {
            return ResponseEntity.<Object>ok(body.apply(result.value()));
        }
        return error(result.error(), result.message());
    }

    static ResponseEntity<Object> error(LendingError error, String message) {
        HttpStatus status = statusFor(error);
        return ResponseEntity.status(status).body(Map.<String, Object>of(
                "timestamp", Instant.now(),
                "status", status.value(),
                "error", error.name(),
                "message", message == null ? "" : message
        ));
    }

    static HttpStatus statusFor(LendingError error) {
        return switch (error) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_EXISTS -> HttpStatus.CONFLICT;
            case INVALID_AMOUNT, INVALID_PARAMETERS -> HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_SCORE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
        };
    }
}
