package com.cdnpurge.invalidationservice.config;

import com.cdnpurge.invalidation.InvalidationRequestFactory;
import com.cdnpurge.invalidationservice.domain.BatchRetryPolicy;
import com.cdnpurge.invalidationservice.domain.IdempotencyRegistry;
import com.cdnpurge.invalidationservice.domain.InvalidationCompletionListener;
import com.cdnpurge.invalidationservice.domain.InvalidationDispatcher;
import com.cdnpurge.invalidationservice.domain.InvalidationReportStore;
import com.cdnpurge.invalidationservice.domain.InvalidationReporter;
import com.cdnpurge.invalidationservice.domain.TenantProviders;
import com.cdnpurge.invalidationservice.infrastructure.audit.AuditLogCompletionListener;
import com.cdnpurge.invalidationservice.infrastructure.store.InMemoryInvalidationReportStore;
import com.cdnpurge.observability.InvalidationMetrics;
import com.cdnpurge.observability.ProviderCallTracer;
import com.cdnpurge.provider.JdkProviderTransport;
import com.cdnpurge.provider.ProviderAdapters;
import com.cdnpurge.provider.ProviderConfig;
import com.cdnpurge.provider.ProviderTransport;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.Collections;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the dispatcher, its provider adapters and the result reporter.
 */
@Configuration
public class DispatcherConfiguration {

    static final String WORKER_POOL_METRIC_NAME = "cdn-purge.workers";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderTransport providerTransport(DispatchProperties dispatch) {
        return new JdkProviderTransport(dispatch.connectTimeout(), dispatch.requestTimeout());
    }

    @Bean
    public ProviderCallTracer providerCallTracer() {
        return new ProviderCallTracer(GlobalOpenTelemetry.getTracer("cdn-purge"));
    }

    @Bean
    public InvalidationMetrics invalidationMetrics(MeterRegistry registry, InvalidationServiceProperties service) {
        return new InvalidationMetrics(registry, service.name());
    }

    @Bean
    public TenantProviders tenantProviders(TenantProvidersProperties tenants, ProviderTransport transport,
                                           ProviderCallTracer tracer, Clock clock) {
        Map<String, ProviderConfig> configs = new LinkedHashMap<>();
        tenants.tenants().forEach((tenantId, settings) -> {
            try {
                configs.put(tenantId, settings.toProviderConfig());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("cdnpurge.tenants." + tenantId + ": " + e.getMessage(), e);
            }
        });
        return new TenantProviders(configs, new ProviderAdapters(transport, tracer, clock)::create);
    }

    /**
     * Bounded pool submitting batches. A full queue refuses new batches, which the dispatcher
     * reports as failed and retryable. Shutdown waits for batches already running.
     */
    @Bean
    public ThreadPoolTaskExecutor invalidationExecutor(DispatchProperties dispatch) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(dispatch.workerThreads());
        executor.setMaxPoolSize(dispatch.workerThreads());
        executor.setQueueCapacity(dispatch.queueCapacity());
        executor.setThreadNamePrefix("cdn-purge-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) dispatch.shutdownTimeout().toSeconds());
        return executor;
    }

    /** Pool size, queue depth and task counts of the worker pool, bound by the meter registry. */
    @Bean
    public ExecutorServiceMetrics invalidationExecutorMetrics(ThreadPoolTaskExecutor invalidationExecutor) {
        return new ExecutorServiceMetrics(invalidationExecutor.getThreadPoolExecutor(), WORKER_POOL_METRIC_NAME,
                Collections.emptyList());
    }

    @Bean
    public BatchRetryPolicy batchRetryPolicy(DispatchProperties dispatch) {
        return new BatchRetryPolicy(dispatch.maxAttempts(), dispatch.initialBackoff(), dispatch.backoffMultiplier());
    }

    @Bean
    public InvalidationReportStore invalidationReportStore() {
        return new InMemoryInvalidationReportStore(10_000);
    }

    @Bean
    public AuditLogCompletionListener auditLogCompletionListener() {
        return new AuditLogCompletionListener();
    }

    @Bean
    public InvalidationReporter invalidationReporter(InvalidationReportStore store,
                                                     List<InvalidationCompletionListener> listeners, Clock clock) {
        return new InvalidationReporter(store, listeners, clock);
    }

    @Bean
    public InvalidationDispatcher invalidationDispatcher(
            TenantProviders providers,
            InvalidationReporter reporter,
            BatchRetryPolicy retryPolicy,
            InvalidationMetrics metrics,
            ThreadPoolTaskExecutor invalidationExecutor,
            Clock clock) {
        return new InvalidationDispatcher(providers, new InvalidationRequestFactory(clock), reporter,
                retryPolicy, new IdempotencyRegistry(), metrics, invalidationExecutor);
    }
}
