package com.myorg.hitl.worker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs {@code hitl.worker.concurrency} drafting loops on dedicated threads for the lifetime of
 * the application context.
 */
@Slf4j
public class DraftingWorkerPool implements SmartLifecycle {

    private final List<DraftingWorker> workers;
    private final HitlWorkerProperties props;

    private volatile boolean running;
    private volatile CountDownLatch stopSignal;
    private ExecutorService executor;

    public DraftingWorkerPool(List<DraftingWorker> workers, HitlWorkerProperties props) {
        this.workers = List.copyOf(workers);
        this.props = props;
    }

    public List<DraftingWorker> workers() {
        return workers;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        stopSignal = new CountDownLatch(1);
        AtomicInteger n = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workers.size(), r -> {
            Thread t = new Thread(r, "hitl-drafter-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (DraftingWorker w : workers) {
            executor.execute(() -> loop(w));
        }
        running = true;
        log.info("Drafting worker pool started (workers={})", workers.size());
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        workers.forEach(DraftingWorker::requestStop);
        stopSignal.countDown();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Drafting workers still busy after {}; claims will be released by lease expiry",
                        props.getShutdownTimeout());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        running = false;
        log.info("Drafting worker pool stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return props.isSchedulingEnabled();
    }

    private void loop(DraftingWorker w) {
        int quietPolls = 0;
        while (!w.isStopRequested()) {
            PollOutcome outcome;
            try {
                outcome = w.runOnce();
            } catch (RuntimeException e) {
                log.error("Unexpected failure in drafting loop {}", w.workerId(), e);
                outcome = PollOutcome.STORE_ERROR;
            }
            if (outcome == PollOutcome.CANCELLED) break;

            if (outcome.pollImmediately()) {
                quietPolls = 0;
                continue;
            }
            quietPolls++;
            try {
                if (stopSignal.await(backoff(quietPolls).toMillis(), TimeUnit.MILLISECONDS)) break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("Drafting loop {} exited", w.workerId());
    }

    /** quietPolls=1 => pollInterval, 2 => 2*pollInterval, ... capped at backoffMax */
    Duration backoff(int quietPolls) {
        long baseMs = Math.max(1, props.getPollInterval().toMillis());
        int pow = Math.max(0, quietPolls - 1);
        long ms = baseMs * (1L << Math.min(30, pow));
        return Duration.ofMillis(Math.min(ms, props.getBackoffMax().toMillis()));
    }
}
