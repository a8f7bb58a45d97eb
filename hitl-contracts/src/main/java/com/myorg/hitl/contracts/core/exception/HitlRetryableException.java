package com.myorg.hitl.contracts.core.exception;

public class HitlRetryableException extends HitlException {

    public HitlRetryableException(ErrorKind kind, String msg) {
        this(kind, msg, null);
    }

    public HitlRetryableException(ErrorKind kind, String msg, Throwable cause) {
        super(requireRetryable(kind), kind.name(), msg, cause);
    }

    private static ErrorKind requireRetryable(ErrorKind kind) {
        if (kind == null || !kind.retryable()) {
            throw new IllegalArgumentException("kind must be retryable: " + kind);
        }
        return kind;
    }
}
