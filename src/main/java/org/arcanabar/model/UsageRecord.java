package org.arcanabar.model;

import java.time.Instant;

/**
 * Счётчики одного пользователя, как их видят вызывающие.
 * <p>
 * {@code unlimited} не хранится: вычисляется по allow-list при каждом чтении.
 * {@code createdAt}/{@code updatedAt} равны {@code null}, пока пользователь ни разу не гадал.
 */
public record UsageRecord(
        String userId,
        int basicCount,
        int premiumCount,
        boolean unlimited,
        Instant createdAt,
        Instant updatedAt
) {

    public static UsageRecord unseen(String userId, boolean unlimited) {
        return new UsageRecord(userId, 0, 0, unlimited, null, null);
    }

    public boolean seen() {
        return createdAt != null;
    }

    public boolean limitReached(int freeLimit) {
        return !unlimited && basicCount >= freeLimit;
    }
}
