package com.myorg.hitl.worker;

import com.myorg.hitl.contracts.ticket.Ticket;

/** Extension points for tests (simulate a crash right after a claim, slow drafting...). */
public interface DraftingWorkerHooks {
    default void afterClaim(Ticket claimed) {}
    default void beforeDraft(Ticket claimed) {}
}
