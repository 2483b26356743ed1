package dev.issuehook.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

/**
 * Executor for the similarity search.
 *
 * <p>Search runs off the request thread so the handler can give up on it after
 * {@code issuehook.search.timeout}. The pool is bounded: a slow search backend
 * should fill the queue, not spawn unlimited threads.
 *
 * <p>MDC is copied to the worker so deliveryId and issueNumber stay on the
 * search log lines.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "enrichmentExecutor")
    public ThreadPoolTaskExecutor enrichmentExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setTaskDecorator(new MdcPropagatingTaskDecorator());
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("enrichment-");
        executor.initialize();
        return executor;
    }

    /**
     * Propagates MDC context from the calling thread to the worker thread.
     */
    static class MdcPropagatingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }
}
