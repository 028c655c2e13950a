package org.arcanabar.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.arcanabar.config.QuotaProperties;
import org.arcanabar.exception.LedgerWriteException;
import org.arcanabar.exception.StorageCorruptionException;
import org.arcanabar.model.UsageRecord;
import org.arcanabar.repository.LedgerFileStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UsageLedgerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T09:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private final ObjectMapper om = new ObjectMapper();
    private Path file;

    @BeforeEach
    void setUp() {
        file = dir.resolve("users.json");
    }

    private UsageLedger ledger(int limit, String... unlimited) {
        return new UsageLedger(new LedgerFileStore(file, om), quota(limit, unlimited), CLOCK);
    }

    private QuotaProperties quota(int limit, String... unlimited) {
        return new QuotaProperties(limit, Set.of(unlimited), file.toString());
    }

    @Test
    @DisplayName("limit=1: first reading allowed, then the user is locked out")
    void singleFreeReading() {
        UsageLedger ledger = ledger(1);

        assertThat(ledger.mayConsume("U1")).isTrue();

        UsageRecord after = ledger.recordConsumption("U1");
        assertThat(after.basicCount()).isEqualTo(1);
        assertThat(after.unlimited()).isFalse();

        assertThat(ledger.mayConsume("U1")).isFalse();
        assertThat(ledger.mayConsume("U1")).isFalse();
        assertThat(ledger.remaining("U1")).hasValue(0);
    }

    @Test
    @DisplayName("allow-listed user is never locked out")
    void allowListedUserIgnoresLimit() {
        UsageLedger ledger = ledger(1, "U2");

        for (int i = 1; i <= 5; i++) {
            UsageRecord r = ledger.recordConsumption("U2");
            assertThat(r.basicCount()).isEqualTo(i);
            assertThat(r.unlimited()).isTrue();
            assertThat(ledger.mayConsume("U2")).isTrue();
        }
        assertThat(ledger.remaining("U2")).isEmpty();
    }

    @Test
    void unseenUserReadsAsZeroWithoutBeingPersisted() {
        UsageLedger ledger = ledger(3);

        UsageRecord r = ledger.get("new-user");

        assertThat(r.basicCount()).isZero();
        assertThat(r.seen()).isFalse();
        assertThat(ledger.size()).isZero();
        assertThat(file).doesNotExist();
        assertThat(ledger.remaining("new-user")).hasValue(3);
    }

    @Test
    void zeroLimitLocksEveryoneExceptAllowList() {
        UsageLedger ledger = ledger(0, "vip");

        assertThat(ledger.mayConsume("anyone")).isFalse();
        assertThat(ledger.mayConsume("vip")).isTrue();
    }

    @Test
    void countsSurviveRestart() {
        UsageLedger first = ledger(3);
        first.recordConsumption("100");
        first.recordConsumption("100");
        first.recordPremium("100");
        first.recordConsumption("200");

        UsageLedger restarted = ledger(3);

        assertThat(restarted.size()).isEqualTo(2);
        UsageRecord r = restarted.get("100");
        assertThat(r.basicCount()).isEqualTo(2);
        assertThat(r.premiumCount()).isEqualTo(1);
        assertThat(r.createdAt()).isEqualTo(CLOCK.instant());
        assertThat(restarted.get("200").basicCount()).isEqualTo(1);
    }

    @Test
    void premiumDoesNotSpendFreeQuota() {
        UsageLedger ledger = ledger(1);

        ledger.recordPremium("U3");
        ledger.recordPremium("U3");

        assertThat(ledger.mayConsume("U3")).isTrue();
        assertThat(ledger.get("U3").premiumCount()).isEqualTo(2);
        assertThat(ledger.get("U3").basicCount()).isZero();
    }

    @Test
    void userIdIsTrimmedAndRequired() {
        UsageLedger ledger = ledger(2);

        ledger.recordConsumption(" 77 ");

        assertThat(ledger.get("77").basicCount()).isEqualTo(1);
        assertThatThrownBy(() -> ledger.recordConsumption(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledger.mayConsume(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("concurrent increments for one user are not lost")
    void concurrentIncrementsForSameUser() throws Exception {
        UsageLedger ledger = ledger(1_000);
        int threads = 8;
        int perThread = 20;

        runConcurrently(threads, t -> {
            for (int i = 0; i < perThread; i++) {
                ledger.recordConsumption("hot-user");
            }
        });

        assertThat(ledger.get("hot-user").basicCount()).isEqualTo(threads * perThread);
        assertThat(ledger(1_000).get("hot-user").basicCount()).isEqualTo(threads * perThread);
    }

    @Test
    void concurrentIncrementsForDifferentUsers() throws Exception {
        UsageLedger ledger = ledger(1_000);
        int threads = 6;
        int perThread = 10;

        runConcurrently(threads, t -> {
            for (int i = 0; i < perThread; i++) {
                ledger.recordConsumption("user-" + t);
                // читатели не должны видеть промежуточное состояние
                assertThat(ledger.get("user-" + t).basicCount()).isEqualTo(i + 1);
            }
        });

        UsageLedger reloaded = ledger(1_000);
        assertThat(reloaded.size()).isEqualTo(threads);
        for (int t = 0; t < threads; t++) {
            assertThat(reloaded.get("user-" + t).basicCount()).isEqualTo(perThread);
        }
    }

    @Test
    void failedWriteKeepsPreviousStateInMemoryAndOnDisk() throws IOException {
        ledger(5).recordConsumption("U1");
        String committed = Files.readString(file);

        LedgerFileStore failing = new LedgerFileStore(file, om) {
            @Override
            protected void moveIntoPlace(Path tmp, Path target) throws IOException {
                throw new IOException("disk full");
            }
        };
        UsageLedger ledger = new UsageLedger(failing, quota(5), CLOCK);

        assertThatThrownBy(() -> ledger.recordConsumption("U1")).isInstanceOf(LedgerWriteException.class);
        assertThatThrownBy(() -> ledger.recordConsumption("U9")).isInstanceOf(LedgerWriteException.class);

        assertThat(ledger.get("U1").basicCount()).isEqualTo(1);
        assertThat(ledger.get("U9").seen()).isFalse();
        assertThat(Files.readString(file)).isEqualTo(committed);
    }

    @Test
    void corruptFileFailsStartup() throws IOException {
        Files.writeString(file, "not json at all");

        assertThatThrownBy(() -> ledger(3)).isInstanceOf(StorageCorruptionException.class);
        assertThat(Files.readString(file)).isEqualTo("not json at all");
    }

    private interface Worker {
        void run(int threadIndex) throws Exception;
    }

    private static void runConcurrently(int threads, Worker worker) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int index = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    worker.run(index);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
