package com.myorg.hitl.contracts.core.exception;

public class DuplicateTicketException extends HitlNonRetryableException {

    public DuplicateTicketException(String ticketId) {
        this(ticketId, null);
    }

    public DuplicateTicketException(String ticketId, Throwable cause) {
        super(ErrorKind.DUPLICATE, "DUPLICATE_TICKET", "Ticket ID " + ticketId + " already exists", cause);
    }
}
