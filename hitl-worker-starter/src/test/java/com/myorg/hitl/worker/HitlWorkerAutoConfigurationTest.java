package com.myorg.hitl.worker;

import com.myorg.hitl.drafting.DraftGenerator;
import com.myorg.hitl.drafting.HitlDraftingProperties;
import com.myorg.hitl.drafting.retrieval.RetrievalContextBuilder;
import com.myorg.hitl.drafting.retrieval.RetrievalIndex;
import com.myorg.hitl.store.TicketTransitionEngine;
import com.myorg.hitl.store.memory.InMemoryTicketStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class HitlWorkerAutoConfigurationTest {

    private static final InMemoryTicketStore STORE = new InMemoryTicketStore(Clock.systemUTC(), Duration.ofMinutes(5));

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(HitlWorkerAutoConfiguration.class))
            .withBean(InMemoryTicketStore.class, () -> STORE)
            .withBean(TicketTransitionEngine.class,
                    () -> new TicketTransitionEngine(STORE, STORE.transactionOperations(), Clock.systemUTC()))
            .withBean(DraftGenerator.class, () -> mock(DraftGenerator.class))
            .withBean(RetrievalContextBuilder.class, () -> new RetrievalContextBuilder(
                    mock(RetrievalIndex.class), mock(RetrievalIndex.class), new HitlDraftingProperties.Retrieval()))
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .withPropertyValues("hitl.worker.scheduling-enabled=false", "hitl.worker.reaper.enabled=false");

    @Test
    void shouldCreateOneWorkerPerConfiguredLoop() {
        runner.withPropertyValues("hitl.worker.concurrency=3").run(ctx -> {
            assertNull(ctx.getStartupFailure());
            DraftingWorkerPool pool = ctx.getBean(DraftingWorkerPool.class);
            assertEquals(3, pool.workers().size());
            assertEquals(3, pool.workers().stream().map(DraftingWorker::workerId).distinct().count());
            assertFalse(pool.isRunning());

            assertNotNull(ctx.getBean(DraftingMetrics.class));
            assertNotNull(ctx.getBean(MeterRegistry.class).find("hitl.pending.eligible").gauge());
            assertTrue(ctx.getBeansOfType(ClaimLeaseReaper.class).isEmpty());
        });
    }

    @Test
    void disabled_shouldBackOff() {
        runner.withPropertyValues("hitl.worker.enabled=false").run(ctx -> {
            assertNull(ctx.getStartupFailure());
            assertTrue(ctx.getBeansOfType(DraftingWorkerPool.class).isEmpty());
        });
    }

    @Test
    void reaperEnabled_shouldRegisterReaperWithSchedule() {
        runner.withPropertyValues("hitl.worker.reaper.enabled=true", "hitl.worker.reaper.initial-delay=1h").run(ctx -> {
            assertNull(ctx.getStartupFailure());
            assertNotNull(ctx.getBean(ClaimLeaseReaper.class));
            assertEquals(3_600_000L, ctx.getBean(HitlWorkerScheduleValues.class).getReaperInitialDelayMs());
        });
    }
}
