package com.myorg.hitl.worker;

import com.myorg.hitl.contracts.core.exception.ErrorKind;
import com.myorg.hitl.contracts.core.exception.HitlException;

/**
 * Decides what happens to a claimed ticket whose drafting failed. Depends on nothing but the
 * error kind and the attempt count.
 */
public final class DraftFailureClassifier {

    public enum Action {
        /** Roll the claim back; another poll retries it. */
        RELEASE,
        /** Keep it out of the eligible pool until a human retries it. */
        NEEDS_ATTENTION,
        /** The ticket is no longer pending; nothing to roll back. */
        DROP
    }

    private DraftFailureClassifier() {
    }

    public static ErrorKind kindOf(Throwable t) {
        return t instanceof HitlException he ? he.kind() : ErrorKind.UNKNOWN;
    }

    /**
     * @param attempts failed attempts recorded on the ticket before this one
     */
    public static Action decide(Throwable failure, int attempts, int maxAttempts) {
        ErrorKind kind = kindOf(failure);
        if (kind == ErrorKind.NOT_FOUND) return Action.DROP;
        if (!kind.retryable()) return Action.NEEDS_ATTENTION;
        return attempts + 1 >= maxAttempts ? Action.NEEDS_ATTENTION : Action.RELEASE;
    }

    public static String describe(Throwable t) {
        String msg = t.getClass().getSimpleName() + ": " + (t.getMessage() == null ? "" : t.getMessage());
        return msg.length() > 2000 ? msg.substring(0, 2000) : msg;
    }
}
