package com.myorg.hitl.contracts.core.exception;

/** Backing store unreachable or failing. Retryable. */
public class TicketStoreException extends HitlRetryableException {

    public TicketStoreException(String msg, Throwable cause) {
        super(ErrorKind.STORE, msg, cause);
    }
}
