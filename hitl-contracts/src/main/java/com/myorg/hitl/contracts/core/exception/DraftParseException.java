package com.myorg.hitl.contracts.core.exception;

/** Structured draft output is malformed or out of range. */
public class DraftParseException extends HitlNonRetryableException {

    public DraftParseException(String message) {
        super(ErrorKind.PARSE, "DRAFT_PARSE", message);
    }

    public DraftParseException(String message, Throwable cause) {
        super(ErrorKind.PARSE, "DRAFT_PARSE", message, cause);
    }
}
