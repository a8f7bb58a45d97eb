package com.myorg.hitl.contracts.ticket;

import java.time.Instant;

/**
 * Claim bookkeeping of a pending ticket. Meaningless once the ticket left the pending store.
 */
public record DraftingState(
        String claimOwner,
        Instant leaseUntil,
        int attempts,
        boolean needsAttention,
        String lastError
) {
    public static DraftingState unclaimed() {
        return new DraftingState(null, null, 0, false, null);
    }

    public boolean isClaimed() {
        return claimOwner != null;
    }
}
