package teranet.mapdev.loadseries.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Application configuration for parallel per-file processing
 */
@Configuration
public class AppConfig {

    /**
     * Thread pool executor used by the per-file stages (preprocess, outlier, noise).
     * When parallel processing is disabled the caller thread runs every task.
     */
    @Bean(name = "seriesProcessingExecutor")
    public Executor seriesProcessingExecutor(PipelineConfig pipelineConfig) {
        if (!pipelineConfig.isParallel()) {
            return Runnable::run;
        }

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        int poolSize = Math.max(1, pipelineConfig.getMaxConcurrentFiles());
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);

        // Queue capacity - number of tasks to queue when all threads are busy
        executor.setQueueCapacity(1000);

        executor.setThreadNamePrefix("Series-Processing-");

        // Rejection policy - what to do when queue is full
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());

        // Carry the correlation id onto worker threads
        executor.setTaskDecorator(mdcPropagatingDecorator());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
