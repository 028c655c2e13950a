package org.arcanabar.service;

import io.github.resilience4j.retry.Retry;
import org.arcanabar.config.AppProperties;
import org.arcanabar.dto.OpenAiDtos;
import org.arcanabar.exception.FailureReason;
import org.arcanabar.exception.GenerationFailedException;
import org.arcanabar.exception.SchemaViolationException;
import org.arcanabar.exception.TransportFailureException;
import org.arcanabar.model.BasicReading;
import org.arcanabar.model.PremiumReading;
import org.arcanabar.model.ReadingKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Генерация гаданий: промпт по виду гадания, вызов модели с повторами, строгий разбор ответа.
 * <p>
 * Своего изменяемого состояния нет (кроме счётчиков {@link GenerationStats}), параллельные вызовы независимы.
 * Невалидный ответ модели не чинится, а запрашивается заново в пределах того же бюджета попыток.
 */
@Service
public class ReadingGenerator {

    private static final Logger log = LoggerFactory.getLogger(ReadingGenerator.class);

    private final OpenAiClient openAi;
    private final ReadingParser parser;
    private final Retry retry;
    private final ExecutorService executor;
    private final AppProperties.Generation cfg;
    private final GenerationStats stats;

    public ReadingGenerator(OpenAiClient openAi,
                            ReadingParser parser,
                            Retry readingRetry,
                            @Qualifier("readingExecutor") ExecutorService readingExecutor,
                            AppProperties props,
                            GenerationStats stats) {
        this.openAi = openAi;
        this.parser = parser;
        this.retry = readingRetry;
        this.executor = readingExecutor;
        this.cfg = props.generation();
        this.stats = stats;
    }

    public BasicReading generateBasic() {
        return generateBasic(new CallState());
    }

    /**
     * @param context дата рождения или любой другой текст от пользователя; подставляется в промпт как есть
     */
    public PremiumReading generatePremium(String context) {
        return generatePremium(context, new CallState());
    }

    /**
     * Асинхронный вариант. По истечении общего лимита или при {@code cancel} future прерывает
     * задачу в пуле: новые попытки не начинаются, ожидание между попытками обрывается.
     */
    public CompletableFuture<BasicReading> generateBasicAsync() {
        CallState call = new CallState();
        return async(ReadingKind.BASIC, call, () -> generateBasic(call));
    }

    public CompletableFuture<PremiumReading> generatePremiumAsync(String context) {
        requireContext(context);
        CallState call = new CallState();
        return async(ReadingKind.PREMIUM, call, () -> generatePremium(context, call));
    }

    private BasicReading generateBasic(CallState call) {
        return execute(ReadingKind.BASIC, ReadingPrompts.basic(), parser::parseBasic, call);
    }

    private PremiumReading generatePremium(String context, CallState call) {
        requireContext(context);
        return execute(ReadingKind.PREMIUM, ReadingPrompts.premium(context.trim()),
                content -> parser.parsePremium(content, context.trim()), call);
    }

    private <T> T execute(ReadingKind kind, OpenAiDtos.ChatPrompt prompt,
                          Function<String, T> parse, CallState call) {
        long started = System.nanoTime();
        AtomicReference<String> lastRaw = new AtomicReference<>();
        AtomicLong tokens = new AtomicLong();

        Supplier<T> attempt = () -> {
            // не ретраится: предикат повторов пропускает только сбои транспорта и схемы
            if (call.abandoned) {
                throw new CancellationException(kind + " reading abandoned by caller");
            }
            int n = call.attempts.incrementAndGet();
            log.debug("{} reading: attempt {}/{}", kind, n, cfg.maxAttempts());
            OpenAiDtos.Completion completion = openAi.chatJson(prompt);
            lastRaw.set(completion.content());
            tokens.addAndGet(completion.totalTokens());
            return parse.apply(completion.content());
        };

        try {
            T reading = Retry.decorateSupplier(retry, attempt).get();
            long ms = elapsedMs(started);
            if (!call.abandoned) {
                stats.recordSuccess(call.attempts.get(), tokens.get(), ms);
            }
            log.info("{} reading generated in {} ms, attempts={}", kind, ms, call.attempts.get());
            return reading;

        } catch (TransportFailureException e) {
            String raw = e.getBody() != null ? e.getBody() : lastRaw.get();
            throw failed(kind, e.getReason(), call, raw, e, started);

        } catch (SchemaViolationException e) {
            throw failed(kind, FailureReason.SCHEMA_VIOLATION, call, e.getRawPayload(), e, started);
        }
    }

    private GenerationFailedException failed(ReadingKind kind, FailureReason reason, CallState call,
                                             String raw, Throwable cause, long started) {
        long ms = elapsedMs(started);
        int attempts = call.attempts.get();
        if (call.abandoned) {
            // вызывающий уже получил таймаут или отменил вызов, в статистике это учтено
            log.info("{} reading abandoned after {} ms, attempts={}", kind, ms, attempts);
        } else {
            stats.recordFailure(reason, attempts, ms);
            log.error("{} reading failed in {} ms: reason={} attempts={} cause={} lastRaw={}",
                    kind, ms, reason, attempts, cause.getMessage(), OpenAiClient.trunc(raw, 500));
        }
        return new GenerationFailedException(kind, reason, attempts, raw, cause);
    }

    /**
     * Общий лимит на вызов: по его истечении future завершается {@link GenerationFailedException} с NETWORK.
     * Таймаут и отмена прерывают задачу в пуле; на счётчики пользователей это не влияет.
     */
    private <T> CompletableFuture<T> async(ReadingKind kind, CallState call, Supplier<T> work) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            try {
                result.complete(work.get());
            } catch (Throwable e) {
                result.completeExceptionally(e);
            }
        });

        long timeoutMs = cfg.callTimeout().toMillis();
        CompletableFuture.delayedExecutor(timeoutMs, TimeUnit.MILLISECONDS).execute(() -> {
            if (result.isDone()) return;
            call.abandoned = true;
            var timeout = new TimeoutException(kind + " reading exceeded " + timeoutMs + " ms");
            if (result.completeExceptionally(new GenerationFailedException(
                    kind, FailureReason.NETWORK, call.attempts.get(), null, timeout))) {
                stats.recordTimeout();
                log.error("{} reading timed out after {} ms, attempts started={}", kind, timeoutMs, call.attempts.get());
                task.cancel(true);
            }
        });

        result.whenComplete((value, error) -> {
            if (error instanceof CancellationException) {
                call.abandoned = true;
                task.cancel(true);
                log.info("{} reading cancelled by caller, attempts started={}", kind, call.attempts.get());
            }
        });
        return result;
    }

    private static void requireContext(String context) {
        if (context == null || context.isBlank()) {
            throw new IllegalArgumentException("Premium reading context must not be blank");
        }
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    /** Попытки одного вызова и отметка, что результат больше никому не нужен. */
    private static final class CallState {
        final AtomicInteger attempts = new AtomicInteger();
        volatile boolean abandoned;
    }
}
