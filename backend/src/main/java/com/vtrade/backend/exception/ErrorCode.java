package com.vtrade.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes returned in {@code ApiError.errorCode}.
 */
public enum ErrorCode {
    INSUFFICIENT_MARGIN(HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_INSTRUMENT(HttpStatus.UNPROCESSABLE_ENTITY),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
