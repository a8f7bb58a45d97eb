package com.myorg.hitl.contracts.core.exception;

/** The completion service answered with a permanent rejection (auth, bad request, unknown model). */
public class UpstreamRejectedException extends HitlNonRetryableException {

    public UpstreamRejectedException(String reason, String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_REJECTED, reason, message, cause);
    }
}
