package com.myorg.hitl.contracts.core.exception;

import com.myorg.hitl.contracts.ticket.TicketStage;

public class TicketNotFoundException extends HitlNonRetryableException {

    private final String ticketId;

    public TicketNotFoundException(String ticketId, TicketStage stage) {
        super(ErrorKind.NOT_FOUND, "TICKET_NOT_FOUND",
                "Ticket " + ticketId + " not found in " + (stage == null ? "any store" : stage.storeName()));
        this.ticketId = ticketId;
    }

    public String getTicketId() {
        return ticketId;
    }
}
