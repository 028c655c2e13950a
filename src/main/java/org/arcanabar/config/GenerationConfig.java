package org.arcanabar.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.arcanabar.exception.SchemaViolationException;
import org.arcanabar.exception.TransportFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class GenerationConfig {

    private static final Logger log = LoggerFactory.getLogger(GenerationConfig.class);

    /**
     * Повторы генерации: сеть, 429, 5xx и невалидный JSON от модели.
     * Задержка base, 2*base, 4*base... но не больше max.
     */
    @Bean
    public Retry readingRetry(AppProperties props) {
        var g = props.generation();
        var cfg = RetryConfig.custom()
                .maxAttempts(g.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(g.backoffBaseMs(), 2.0, g.backoffMaxMs()))
                .retryOnException(GenerationConfig::isRetryable)
                .build();

        Retry retry = Retry.of("reading-generation", cfg);
        retry.getEventPublisher()
                .onRetry(e -> log.warn("Generation attempt #{} failed, retrying in {} ms: {}",
                        e.getNumberOfRetryAttempts(), e.getWaitInterval().toMillis(),
                        e.getLastThrowable() == null ? "?" : e.getLastThrowable().getMessage()))
                .onError(e -> log.error("Generation gave up after {} attempt(s): {}",
                        e.getNumberOfRetryAttempts(),
                        e.getLastThrowable() == null ? "?" : e.getLastThrowable().getMessage()));
        return retry;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService readingExecutor(AppProperties props) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "reading-gen-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(props.generation().executorThreads(), tf);
    }

    static boolean isRetryable(Throwable t) {
        if (t instanceof TransportFailureException tf) return tf.isRetryable();
        return t instanceof SchemaViolationException;
    }
}
