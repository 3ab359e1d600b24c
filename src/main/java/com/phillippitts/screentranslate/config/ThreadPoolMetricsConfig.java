package com.phillippitts.screentranslate.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes flow executor gauges via Micrometer:
 * <ul>
 *   <li>flow.pool.size - current number of threads</li>
 *   <li>flow.pool.active - threads running a flow</li>
 *   <li>flow.pool.queued - flows waiting for a thread</li>
 *   <li>flow.pool.completed - cumulative completed flows</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> flowExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("flowExecutor") ObjectProvider<ThreadPoolTaskExecutor> flowExecutorProvider) {
        this.flowExecutorProvider = flowExecutorProvider;
    }

    @Bean
    public MeterBinder flowExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = flowExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("flow.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the flow pool")
                    .register(registry);

            Gauge.builder("flow.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively running flows")
                    .register(registry);

            Gauge.builder("flow.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of flows waiting in the queue")
                    .register(registry);

            Gauge.builder("flow.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed flow tasks")
                    .register(registry);

            LOG.info("Flow thread pool metrics registered: flow.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = flowExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Flow Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
