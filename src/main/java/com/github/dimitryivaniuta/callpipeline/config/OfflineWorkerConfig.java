package com.github.dimitryivaniuta.callpipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.callpipeline.executor.CallExecutor;
import com.github.dimitryivaniuta.callpipeline.metrics.PipelineMetrics;
import com.github.dimitryivaniuta.callpipeline.offline.DeadLetterQueue;
import com.github.dimitryivaniuta.callpipeline.offline.LoggingOfflineEventHandler;
import com.github.dimitryivaniuta.callpipeline.offline.OfflineEventHandler;
import com.github.dimitryivaniuta.callpipeline.offline.OfflineQueueClient;
import com.github.dimitryivaniuta.callpipeline.offline.OfflineSyncWorker;
import com.github.dimitryivaniuta.callpipeline.offline.OfflineWorkerLoop;
import com.github.dimitryivaniuta.callpipeline.offline.OfflineWorkerRunner;
import com.github.dimitryivaniuta.callpipeline.offline.RetryBudget;
import com.github.dimitryivaniuta.callpipeline.support.CanonicalJson;
import com.github.dimitryivaniuta.callpipeline.tenant.TenantIdentity;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Offline queue worker, active with {@code rest-pipeline.worker.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(prefix = "rest-pipeline.worker", name = "enabled", havingValue = "true")
public class OfflineWorkerConfig {

    @Bean
    @ConditionalOnMissingBean
    public OfflineEventHandler offlineEventHandler() {
        return new LoggingOfflineEventHandler();
    }

    @Bean
    public OfflineQueueClient offlineQueueClient(CallExecutor executor) {
        return new OfflineQueueClient(executor);
    }

    @Bean
    public RetryBudget retryBudget(PipelineProperties props, ObjectMapper mapper) {
        return new RetryBudget(PipelineConfig.stateFile(props, PipelineConfig.RETRY_STATE_FILE), mapper,
                props.getWorker().getMaxRetries());
    }

    @Bean
    public OfflineSyncWorker offlineSyncWorker(PipelineProperties props,
                                               OfflineQueueClient queue,
                                               OfflineEventHandler handler,
                                               RetryBudget retryBudget,
                                               DeadLetterQueue deadLetterQueue,
                                               CanonicalJson canonicalJson,
                                               PipelineMetrics metrics,
                                               Clock clock,
                                               TenantIdentity tenant) {
        return new OfflineSyncWorker(queue, handler, retryBudget, deadLetterQueue, canonicalJson, metrics, clock,
                tenant.rateLimitKey(), props.getWorker().getApplicationToken());
    }

    @Bean
    public OfflineWorkerLoop offlineWorkerLoop(PipelineProperties props, OfflineSyncWorker worker, TenantIdentity tenant) {
        PipelineProperties.Worker w = props.getWorker();
        return new OfflineWorkerLoop(worker, w.getIdleSleep(), w.getMaxConsecutiveErrors(), w.isOnce(),
                tenant.rateLimitKey());
    }

    @Bean
    public OfflineWorkerRunner offlineWorkerRunner(OfflineWorkerLoop loop, ConfigurableApplicationContext context) {
        return new OfflineWorkerRunner(loop, code -> System.exit(SpringApplication.exit(context, () -> code)));
    }
}
