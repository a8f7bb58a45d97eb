package com.myorg.hitl.store;

import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketStage;

import java.util.List;
import java.util.Optional;

/**
 * The four named lifecycle stores behind one facade. Implementations translate their
 * infrastructure failures into {@code TicketStoreException}.
 */
public interface TicketStore {

    /**
     * Insert a brand-new ticket and reserve its id across all stores.
     *
     * @throws com.myorg.hitl.contracts.core.exception.DuplicateTicketException if the id exists in any store
     */
    void create(TicketStage stage, Ticket ticket);

    /**
     * Insert a ticket that was just removed from another store by a move. The id is already
     * reserved; only its location changes.
     */
    void put(TicketStage stage, Ticket ticket);

    Optional<Ticket> findById(TicketStage stage, String ticketId);

    /** Atomic: at most one concurrent caller gets the record. */
    Optional<Ticket> findAndDelete(TicketStage stage, String ticketId);

    /** Newest first. */
    List<Ticket> listRecent(TicketStage stage, int limit);

    /** Which store currently owns the id, if any. */
    Optional<TicketStage> locate(String ticketId);
}
