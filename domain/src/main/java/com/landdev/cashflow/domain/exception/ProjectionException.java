package com.landdev.cashflow.domain.exception;

/**
 * Base type for failures raised while building a projection.
 * Raised synchronously to the caller and never retried.
 */
public abstract class ProjectionException extends RuntimeException {

    protected ProjectionException(String message) {
        super(message);
    }

    protected ProjectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
