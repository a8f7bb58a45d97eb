package com.myorg.hitl.contracts.core.exception;

/**
 * Failure categories shared by every module. Callers decide what to do with a failure by its
 * kind, never by its concrete exception class.
 */
public enum ErrorKind {
    STORE(true),
    CONNECTIVITY(true),
    PARSE(false),
    UPSTREAM_REJECTED(false),
    NOT_FOUND(false),
    DUPLICATE(false),
    INVALID_TRANSITION(false),
    UNKNOWN(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
