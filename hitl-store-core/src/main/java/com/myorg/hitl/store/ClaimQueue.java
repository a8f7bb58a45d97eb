package com.myorg.hitl.store;

import com.myorg.hitl.contracts.ticket.Ticket;

import java.util.List;
import java.util.Optional;

/**
 * The only coordination primitive between drafting workers.
 *
 * <p>{@link #claimNext(String)} must be a single atomic read-modify-write against the pending
 * store: concurrent callers never receive the same ticket.
 */
public interface ClaimQueue {

    /**
     * Claim one undrafted pending ticket for {@code owner}: sets the drafted flag, stamps the
     * owner and a lease, and returns the post-update record.
     */
    Optional<Ticket> claimNext(String owner);

    /**
     * Roll a claim back after a retryable failure so the ticket becomes eligible again.
     * Ignored when the claim no longer belongs to {@code owner}.
     *
     * @return true if the claim was released
     */
    boolean release(String ticketId, String owner, String error);

    /** Give a claim back without counting an attempt (worker shutting down). */
    boolean abandon(String ticketId, String owner);

    /**
     * Keep the ticket out of the eligible pool and flag it for a human.
     *
     * @return true if the flag was set
     */
    boolean markNeedsAttention(String ticketId, String owner, String reason);

    /** Clear a needs-attention flag and make the ticket eligible again. */
    boolean retryDraft(String ticketId);

    /** Release claims whose lease expired (worker died between claim and rollback). */
    int releaseExpiredClaims();

    List<Ticket> listNeedsAttention(int limit);

    int countEligible();
}
