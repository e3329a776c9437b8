package com.phillippitts.aerodefect.config;

import com.phillippitts.aerodefect.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the two detector branches of every inspection job.
 *
 * <p>Pool sizes come from {@link ThreadPoolProperties} ({@code threadpool.detector.*} and
 * {@code threadpool.remote.*}). Both pools are {@link ThreadPoolTaskExecutor} beans, so Spring Boot
 * publishes their {@code executor.*} gauges tagged with the bean name.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Bounded executor running local inference.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When pool and queue are full
     * the submitting job thread runs the branch itself, which slows admission instead of dropping work.
     *
     * <p>MDC propagation: the Log4j2 ThreadContext of the submitting thread (requestId, jobId) is
     * copied to the worker for the duration of the task.
     *
     * @return executor for detector branches
     */
    @Bean(name = "detectorExecutor")
    public ThreadPoolTaskExecutor detectorExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor(threadPoolProperties.getDetector());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Executor for remote vision calls, kept apart so a hung endpoint cannot hold threads that local
     * inference needs.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A saturated pool rejects the branch,
     * which the job records as a failed remote detector. Pending calls are interrupted on shutdown.
     *
     * @return executor for remote detector branches
     */
    @Bean(name = "remoteDetectorExecutor")
    public ThreadPoolTaskExecutor remoteDetectorExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor(threadPoolProperties.getRemote());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.DetectorPoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setTaskDecorator(threadContextPropagator());
        return executor;
    }

    static TaskDecorator threadContextPropagator() {
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
