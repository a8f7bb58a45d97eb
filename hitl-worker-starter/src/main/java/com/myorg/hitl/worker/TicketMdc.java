package com.myorg.hitl.worker;

import com.myorg.hitl.contracts.ticket.TicketStage;
import org.slf4j.MDC;

public final class TicketMdc {

    public static final String TICKET_ID = "ticketId";
    public static final String STAGE = "stage";
    public static final String WORKER_ID = "workerId";

    private TicketMdc() {
    }

    public static void put(String ticketId, TicketStage stage, String workerId) {
        if (ticketId != null) MDC.put(TICKET_ID, ticketId);
        if (stage != null) MDC.put(STAGE, stage.storeName());
        if (workerId != null) MDC.put(WORKER_ID, workerId);
    }

    public static void clear() {
        MDC.remove(TICKET_ID);
        MDC.remove(STAGE);
        MDC.remove(WORKER_ID);
    }
}
