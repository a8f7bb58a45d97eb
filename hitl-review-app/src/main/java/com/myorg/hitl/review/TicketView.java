package com.myorg.hitl.review;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketStage;

public record TicketView(String stage, ConfidenceBand confidenceBand, @JsonUnwrapped Ticket ticket) {

    public static TicketView of(TicketStage stage, Ticket t) {
        return new TicketView(stage.storeName(), ConfidenceBand.of(t.getConfidence()), t);
    }
}
