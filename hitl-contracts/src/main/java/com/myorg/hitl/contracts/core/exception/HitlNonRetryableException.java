package com.myorg.hitl.contracts.core.exception;

public class HitlNonRetryableException extends HitlException {

    public HitlNonRetryableException(String message) {
        this(ErrorKind.UNKNOWN, "NON_RETRYABLE", message, null);
    }

    public HitlNonRetryableException(ErrorKind kind, String reason, String message) {
        this(kind, reason, message, null);
    }

    public HitlNonRetryableException(ErrorKind kind, String reason, String message, Throwable cause) {
        super(kind, reason, message, cause);
    }
}
