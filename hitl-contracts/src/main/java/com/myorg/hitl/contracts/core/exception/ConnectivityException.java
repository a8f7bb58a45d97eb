package com.myorg.hitl.contracts.core.exception;

/** Completion service or retrieval index unreachable. Retryable. */
public class ConnectivityException extends HitlRetryableException {

    public ConnectivityException(String msg) {
        super(ErrorKind.CONNECTIVITY, msg);
    }

    public ConnectivityException(String msg, Throwable cause) {
        super(ErrorKind.CONNECTIVITY, msg, cause);
    }
}
