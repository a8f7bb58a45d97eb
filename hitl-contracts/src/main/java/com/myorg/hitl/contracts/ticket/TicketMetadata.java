package com.myorg.hitl.contracts.ticket;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TicketMetadata {
    private String category;
    private String priority;
    private Instant createdAt;
    private Instant closedAt; // completed only
    private boolean drafted; // is_drafted
    private String tone;
    private String escalationReason; // escalated only
    private boolean manuallyHandled; // completion defaults applied
}
