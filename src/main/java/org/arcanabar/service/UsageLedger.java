package org.arcanabar.service;

import org.arcanabar.config.QuotaProperties;
import org.arcanabar.exception.StorageCorruptionException;
import org.arcanabar.model.UsageRecord;
import org.arcanabar.repository.LedgerEntry;
import org.arcanabar.repository.LedgerFileStore;
import org.arcanabar.repository.LedgerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;

/**
 * Счётчики бесплатных и платных гаданий по пользователям.
 * <p>
 * Чтения идут по volatile-ссылке на неизменяемый снимок и не ждут записи на диск.
 * Любое изменение проходит под одним на процесс локом: взять текущий снимок, посчитать новый,
 * записать файл, и только после успешной записи опубликовать новый снимок.
 * Если запись упала, в памяти остаётся прежнее состояние, а ошибка уходит вызывающему.
 */
public class UsageLedger {

    private static final Logger log = LoggerFactory.getLogger(UsageLedger.class);

    private final LedgerFileStore store;
    private final QuotaProperties quota;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile LedgerSnapshot snapshot;

    public UsageLedger(LedgerFileStore store, QuotaProperties quota, Clock clock) {
        this.store = store;
        this.quota = quota;
        this.clock = clock;
        try {
            this.snapshot = store.load();
        } catch (StorageCorruptionException e) {
            log.error("Ledger file {} is corrupt, refusing to start with an empty ledger", e.getFile());
            throw e;
        }
        log.info("Usage ledger ready: file={}, users={}, freeLimit={}, unlimitedUsers={}",
                store.getFile(), snapshot.users().size(), quota.freeLimit(), quota.unlimitedUsers().size());
    }

    public boolean mayConsume(String userId) {
        return !get(userId).limitReached(quota.freeLimit());
    }

    public UsageRecord get(String userId) {
        String id = requireUserId(userId);
        LedgerEntry entry = snapshot.find(id);
        return entry == null ? UsageRecord.unseen(id, quota.isUnlimited(id)) : toRecord(id, entry);
    }

    /**
     * Списывает одно бесплатное гадание. Вызывать только после успешной генерации.
     *
     * @return запись после увеличения счётчика
     */
    public UsageRecord recordConsumption(String userId) {
        return mutate(userId, LedgerEntry::withBasicUsed);
    }

    /**
     * Отмечает оплаченное гадание. На бесплатный лимит не влияет.
     */
    public UsageRecord recordPremium(String userId) {
        return mutate(userId, LedgerEntry::withPremiumUsed);
    }

    /** Сколько бесплатных гаданий осталось; пусто для пользователей без лимита. */
    public OptionalInt remaining(String userId) {
        UsageRecord r = get(userId);
        if (r.unlimited()) return OptionalInt.empty();
        return OptionalInt.of(Math.max(0, quota.freeLimit() - r.basicCount()));
    }

    public int freeLimit() {
        return quota.freeLimit();
    }

    public int size() {
        return snapshot.users().size();
    }

    private UsageRecord mutate(String userId, BiFunction<LedgerEntry, Instant, LedgerEntry> change) {
        String id = requireUserId(userId);
        writeLock.lock();
        try {
            LedgerSnapshot current = snapshot;
            Instant now = clock.instant();
            LedgerEntry before = current.find(id);
            LedgerEntry after = change.apply(before == null ? LedgerEntry.fresh(now) : before, now);

            LedgerSnapshot next = current.with(id, after);
            store.write(next);
            snapshot = next;

            log.debug("Ledger updated for user {}: basic={}, premium={}", id, after.basicCount(), after.premiumCount());
            return toRecord(id, after);
        } finally {
            writeLock.unlock();
        }
    }

    private UsageRecord toRecord(String id, LedgerEntry e) {
        return new UsageRecord(id, e.basicCount(), e.premiumCount(), quota.isUnlimited(id), e.createdAt(), e.updatedAt());
    }

    private static String requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        return userId.trim();
    }
}
