package com.myorg.hitl.worker;

import com.myorg.hitl.store.ClaimQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

@RequiredArgsConstructor
public class DraftingMetrics {

    private final MeterRegistry registry;
    private final ClaimQueue queue;

    private Counter claimed;
    private Counter drafted;
    private Counter released;
    private Counter needsAttention;
    private Counter superseded;
    private Timer draft;

    public void preRegister() {
        claimed = Counter.builder("hitl.worker.claimed").register(registry);
        drafted = Counter.builder("hitl.worker.drafted").register(registry);
        released = Counter.builder("hitl.worker.released").register(registry);
        needsAttention = Counter.builder("hitl.worker.needs_attention").register(registry);
        superseded = Counter.builder("hitl.worker.superseded").register(registry);
        draft = Timer.builder("hitl.worker.draft")
                .description("claim to persisted draft, successful tickets only")
                .register(registry);

        registry.gauge("hitl.pending.eligible", queue, DraftingMetrics::eligibleOrNaN);
    }

    public void incClaimed() { if (claimed != null) claimed.increment(); }
    public void incDrafted() { if (drafted != null) drafted.increment(); }
    public void incReleased() { if (released != null) released.increment(); }
    public void incNeedsAttention() { if (needsAttention != null) needsAttention.increment(); }
    public void incSuperseded() { if (superseded != null) superseded.increment(); }

    public void recordDraft(Duration d) { if (draft != null) draft.record(d); }

    private static double eligibleOrNaN(ClaimQueue q) {
        try {
            return q.countEligible();
        } catch (RuntimeException e) {
            return Double.NaN;
        }
    }
}
