package com.myorg.hitl.review;

import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketMetadata;
import com.myorg.hitl.contracts.ticket.TicketStage;
import com.myorg.hitl.store.TicketStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Fills an empty installation with forty demo tickets, ten per store. Does nothing if the first
 * demo ticket already exists somewhere.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "hitl.sample-data", name = "enabled", havingValue = "true")
public class SampleDataLoader implements ApplicationRunner {

    static final Instant BASE_TIME = Instant.parse("2025-12-30T09:00:00Z");

    private final TicketStore store;

    @Override
    public void run(ApplicationArguments args) {
        if (store.locate(id(1)).isPresent()) {
            log.info("Sample data already present; skipping");
            return;
        }
        int n = 0;
        for (int i = 1; i <= 10; i++, n++) store.create(TicketStage.PENDING, pending(i));
        for (int i = 11; i <= 20; i++, n++) store.create(TicketStage.DRAFTED, drafted(i));
        for (int i = 21; i <= 30; i++, n++) store.create(TicketStage.COMPLETED, completed(i));
        for (int i = 31; i <= 40; i++, n++) store.create(TicketStage.ESCALATED, escalated(i));
        log.info("{} sample tickets loaded", n);
    }

    static String id(int i) {
        return String.format("TKT_%04d", i);
    }

    static Ticket pending(int i) {
        return Ticket.builder()
                .ticketId(id(i))
                .issue("Network connectivity issue reported by user " + i)
                .usedPolicy("Standard Network Protocol")
                .metadata(TicketMetadata.builder()
                        .createdAt(BASE_TIME.plus(Duration.ofMinutes(i * 10L)))
                        .category("Technical")
                        .priority("medium")
                        .build())
                .build();
    }

    static Ticket drafted(int i) {
        return Ticket.builder()
                .ticketId(id(i))
                .issue("Request for account upgrade - Tier " + (i - 10))
                .usedPolicy("Subscription Upgrade Policy")
                .aiDraftedResponse("Your account upgrade request has been processed successfully.")
                .usedReferenceTicketId(id(i - 10))
                .confidence(0.88)
                .metadata(TicketMetadata.builder()
                        .createdAt(BASE_TIME.plus(Duration.ofMinutes(i * 12L)))
                        .category("Billing")
                        .priority("high")
                        .drafted(true)
                        .tone("Professional")
                        .build())
                .build();
    }

    static Ticket completed(int i) {
        Instant created = BASE_TIME.plus(Duration.ofMinutes(i * 15L));
        return Ticket.builder()
                .ticketId(id(i))
                .issue("Hardware failure report #" + i)
                .resolution("Replacement unit shipped and tracking number provided.")
                .aiDraftedResponse("We have processed your replacement. Your tracking ID is XYZ.")
                .usedPolicy("Hardware Warranty Policy")
                .usedReferenceTicketId("REF_GLOBAL_01")
                .confidence(0.95)
                .metadata(TicketMetadata.builder()
                        .createdAt(created)
                        .closedAt(created.plus(Duration.ofHours(2)))
                        .category("Hardware")
                        .priority("medium")
                        .drafted(true)
                        .tone("Helpful")
                        .build())
                .build();
    }

    static Ticket escalated(int i) {
        return Ticket.builder()
                .ticketId(id(i))
                .issue("Urgent security breach or payment failure reported by VIP user " + i)
                .usedPolicy("Critical Escalation Protocol")
                .aiDraftedResponse("This ticket is Escalated. A senior manager is reviewing your case.")
                .usedReferenceTicketId(id(i - 20))
                .confidence(0.65)
                .metadata(TicketMetadata.builder()
                        .createdAt(BASE_TIME.plus(Duration.ofMinutes(i * 8L)))
                        .category("Security")
                        .priority("critical")
                        .drafted(true)
                        .escalationReason("High priority / Complexity")
                        .build())
                .build();
    }
}
