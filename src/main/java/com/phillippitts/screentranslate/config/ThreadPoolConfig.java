package com.phillippitts.screentranslate.config;

import com.phillippitts.screentranslate.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the executors that run translation flows off the caller's thread and
 * engines side by side in parallel selection mode.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.flow.*},
 * {@code threadpool.translation.*}).
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded flow pool.
     *
     * <ul>
     *   <li>Core pool: default 2 - the current flow plus one being replaced</li>
     *   <li>Max pool: default 4</li>
     *   <li>Queue: default 10 tasks</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A rejected flow fails
     * immediately instead of running on the request thread.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext of the submitting thread so the
     * request id stays on flow log lines.
     *
     * @return configured executor for flows
     */
    @Bean(name = "flowExecutor")
    public ThreadPoolTaskExecutor flowExecutor() {
        return newExecutor(threadPoolProperties.getFlow(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Creates the pool that runs one task per engine for parallel translation.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When saturated, an
     * engine runs on the requesting flow thread instead of failing the request.
     *
     * @return configured executor for parallel engines
     */
    @Bean(name = "translationExecutor")
    public ThreadPoolTaskExecutor translationExecutor() {
        return newExecutor(threadPoolProperties.getTranslation(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props,
                                                      RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
