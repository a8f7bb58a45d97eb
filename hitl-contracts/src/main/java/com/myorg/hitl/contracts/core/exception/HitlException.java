package com.myorg.hitl.contracts.core.exception;

public abstract class HitlException extends RuntimeException {

    private final ErrorKind kind;
    private final String reason;

    protected HitlException(ErrorKind kind, String reason, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? ErrorKind.UNKNOWN : kind;
        this.reason = (reason == null || reason.isBlank()) ? this.kind.name() : reason;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String getReason() {
        return reason;
    }

    public boolean isRetryable() {
        return kind.retryable();
    }
}
