package com.myorg.hitl.worker;

import com.myorg.hitl.contracts.drafting.DraftRequest;
import com.myorg.hitl.contracts.drafting.DraftResult;
import com.myorg.hitl.contracts.ticket.Ticket;
import com.myorg.hitl.contracts.ticket.TicketMetadata;
import com.myorg.hitl.contracts.ticket.TicketStage;
import com.myorg.hitl.drafting.DraftGenerator;
import com.myorg.hitl.drafting.HitlDraftingProperties;
import com.myorg.hitl.drafting.retrieval.RetrievalContextBuilder;
import com.myorg.hitl.drafting.retrieval.RetrievalIndex;
import com.myorg.hitl.store.TicketTransitionEngine;
import com.myorg.hitl.store.memory.InMemoryTicketStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/** In-memory pipeline shared by the worker tests. */
class WorkerFixture {

    final Clock clock = Clock.systemUTC();
    final InMemoryTicketStore store;
    final TicketTransitionEngine transitions;
    final RetrievalContextBuilder retrieval;
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final DraftingMetrics metrics;
    final HitlWorkerProperties props = new HitlWorkerProperties();

    WorkerFixture(Duration lease) {
        store = new InMemoryTicketStore(clock, lease);
        transitions = new TicketTransitionEngine(store, store.transactionOperations(), clock);

        RetrievalIndex empty = mock(RetrievalIndex.class);
        when(empty.name()).thenReturn("empty");
        when(empty.similaritySearch(anyString(), anyInt())).thenReturn(List.of());
        retrieval = new RetrievalContextBuilder(empty, empty, new HitlDraftingProperties.Retrieval());

        metrics = new DraftingMetrics(registry, store);
        metrics.preRegister();
    }

    DraftingWorker worker(String id, DraftGenerator generator, DraftingWorkerHooks hooks) {
        return new DraftingWorker(id, store, retrieval, generator, transitions, props, clock, hooks, metrics);
    }

    void pending(String id) {
        store.create(TicketStage.PENDING, Ticket.builder()
                .ticketId(id)
                .issue("My order " + id + " arrived damaged, I want a refund")
                .metadata(TicketMetadata.builder().createdAt(Instant.now()).category("Billing").build())
                .build());
    }

    int count(TicketStage stage) {
        return store.listRecent(stage, 1000).size();
    }

    double counter(String name) {
        return registry.get(name).counter().count();
    }

    static DraftGenerator echoGenerator() {
        return (DraftRequest req) -> new DraftResult(req.ticketId(),
                "Sorry about that, a refund is on its way.", "apologetic", 0.9, "Refund Policy", null);
    }
}
