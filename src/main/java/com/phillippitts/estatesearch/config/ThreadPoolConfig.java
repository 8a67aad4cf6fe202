package com.phillippitts.estatesearch.config;

import com.phillippitts.estatesearch.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for the orchestration engine.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on session volume and worker latency.
 *
 * <p>Rejection policy for both executors: {@link ThreadPoolExecutor.CallerRunsPolicy}.
 * When the pool and queue are full, the submitting thread runs the task, providing
 * backpressure instead of failing fast.
 *
 * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
 * the pool thread to preserve request/session correlation IDs in async logs.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Drains session mailboxes. One drain loop per busy session at a time, so the pool size
     * bounds how many sessions make progress concurrently.
     *
     * @return Configured executor for session mailbox processing
     */
    @Bean(name = "coordinatorExecutor")
    public Executor coordinatorExecutor() {
        return buildExecutor(threadPoolProperties.getCoordinator());
    }

    /**
     * Performs outbound worker dispatch (HTTP POST to worker inboxes) off the mailbox threads.
     *
     * @return Configured executor for worker dispatch
     */
    @Bean(name = "workerExecutor")
    public Executor workerExecutor() {
        return buildExecutor(threadPoolProperties.getWorker());
    }

    /**
     * Scheduler for {@code @Scheduled} sweeps and dispatch retry backoff.
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitter's ThreadContext onto the pool thread and restores the pool
     * thread's own context afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
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
