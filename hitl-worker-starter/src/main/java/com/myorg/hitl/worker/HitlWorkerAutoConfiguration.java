package com.myorg.hitl.worker;

import com.myorg.hitl.drafting.DraftGenerator;
import com.myorg.hitl.drafting.retrieval.RetrievalContextBuilder;
import com.myorg.hitl.store.ClaimQueue;
import com.myorg.hitl.store.TicketTransitionEngine;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@AutoConfiguration(afterName = {
        "com.myorg.hitl.store.jdbc.HitlStoreAutoConfiguration",
        "com.myorg.hitl.drafting.HitlDraftingAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@EnableConfigurationProperties(HitlWorkerProperties.class)
@ConditionalOnProperty(prefix = "hitl.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HitlWorkerAutoConfiguration {

    @Bean(name = "hitlWorkerSchedule")
    public HitlWorkerScheduleValues hitlWorkerScheduleValues(HitlWorkerProperties props) {
        return new HitlWorkerScheduleValues(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public DraftingWorkerHooks draftingWorkerHooks() {
        return new DraftingWorkerHooks() {};
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "hitl.worker.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnBean({ ClaimQueue.class, MeterRegistry.class })
    public DraftingMetrics draftingMetrics(MeterRegistry registry, ClaimQueue queue) {
        DraftingMetrics m = new DraftingMetrics(registry, queue);
        m.preRegister();
        return m;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ ClaimQueue.class, TicketTransitionEngine.class, DraftGenerator.class, RetrievalContextBuilder.class })
    public DraftingWorkerPool draftingWorkerPool(ClaimQueue queue,
                                                 RetrievalContextBuilder retrieval,
                                                 DraftGenerator generator,
                                                 TicketTransitionEngine transitions,
                                                 HitlWorkerProperties props,
                                                 ObjectProvider<Clock> clock,
                                                 DraftingWorkerHooks hooks,
                                                 ObjectProvider<DraftingMetrics> metricsProvider) {
        if (props.getConcurrency() < 1) {
            throw new IllegalArgumentException("hitl.worker.concurrency must be >= 1");
        }
        String instance = "drafter-" + UUID.randomUUID().toString().substring(0, 8);
        Clock c = clock.getIfAvailable(Clock::systemUTC);
        DraftingMetrics metrics = metricsProvider.getIfAvailable();

        List<DraftingWorker> workers = new ArrayList<>();
        for (int i = 1; i <= props.getConcurrency(); i++) {
            workers.add(new DraftingWorker(instance + "-" + i, queue, retrieval, generator, transitions,
                    props, c, hooks, metrics));
        }
        return new DraftingWorkerPool(workers, props);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ClaimQueue.class)
    @ConditionalOnProperty(prefix = "hitl.worker.reaper", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ClaimLeaseReaper claimLeaseReaper(ClaimQueue queue) {
        return new ClaimLeaseReaper(queue);
    }

    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(prefix = "hitl.worker.reaper", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingConfig {}
}
