package com.myorg.hitl.contracts.core.exception;

import com.myorg.hitl.contracts.ticket.TicketStage;

public class InvalidTransitionException extends HitlNonRetryableException {

    public InvalidTransitionException(String ticketId, TicketStage from, TicketStage to) {
        super(ErrorKind.INVALID_TRANSITION, "INVALID_TRANSITION",
                "Ticket " + ticketId + " cannot move from " + from + " to " + to);
    }
}
