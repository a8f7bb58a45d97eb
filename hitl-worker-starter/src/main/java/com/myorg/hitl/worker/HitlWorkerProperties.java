package com.myorg.hitl.worker;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "hitl.worker")
public class HitlWorkerProperties {

    private boolean enabled = true;

    /** Independent drafting loops in this process. */
    private int concurrency = 1;

    /** Wait after an idle or failed poll; doubled per consecutive idle/failed poll. */
    private Duration pollInterval = Duration.ofSeconds(5);
    private Duration backoffMax = Duration.ofMinutes(1);

    /** A retryable failure on the n-th attempt with n >= maxAttempts parks the ticket for a human. */
    private int maxAttempts = 5;

    /** How long stop() waits for in-flight drafts. */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /** If false, loops are not started with the context; call runOnce() manually (tests). */
    private boolean schedulingEnabled = true;

    private Reaper reaper = new Reaper();
    private Metrics metrics = new Metrics();

    @Data
    public static class Reaper {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(1);
        private Duration initialDelay = Duration.ofSeconds(30);
    }

    @Data
    public static class Metrics {
        private boolean enabled = true;
    }
}
