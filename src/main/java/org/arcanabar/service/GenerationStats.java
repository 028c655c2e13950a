package org.arcanabar.service;

import org.arcanabar.dto.StatsResponse;
import org.arcanabar.exception.FailureReason;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Счётчики вызовов генерации с момента старта процесса. Только в памяти.
 */
@Component
public class GenerationStats {

    private final LongAdder successes = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder timeouts = new LongAdder();
    private final LongAdder attempts = new LongAdder();
    private final LongAdder tokens = new LongAdder();
    private final LongAdder totalMs = new LongAdder();
    private final Map<FailureReason, LongAdder> byReason = new EnumMap<>(FailureReason.class);

    public GenerationStats() {
        for (FailureReason r : FailureReason.values()) {
            byReason.put(r, new LongAdder());
        }
    }

    void recordSuccess(int attemptCount, long tokenCount, long elapsedMs) {
        successes.increment();
        attempts.add(attemptCount);
        tokens.add(tokenCount);
        totalMs.add(elapsedMs);
    }

    void recordFailure(FailureReason reason, int attemptCount, long elapsedMs) {
        failures.increment();
        attempts.add(attemptCount);
        totalMs.add(elapsedMs);
        byReason.get(reason).increment();
    }

    // вызов мог ещё завершиться в фоне; здесь только факт, что вызывающий не дождался
    void recordTimeout() {
        timeouts.increment();
    }

    public StatsResponse snapshot() {
        long ok = successes.sum();
        long failed = failures.sum();
        long total = ok + failed;
        Map<String, Long> reasons = new LinkedHashMap<>();
        byReason.forEach((r, n) -> reasons.put(r.name(), n.sum()));
        return new StatsResponse(
                total,
                ok,
                failed,
                timeouts.sum(),
                ok * 100.0 / Math.max(total, 1),
                attempts.sum(),
                total == 0 ? 0.0 : (double) totalMs.sum() / total,
                tokens.sum(),
                reasons
        );
    }
}
