package org.arcanabar.repository;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * Запись пользователя в том виде, в каком она лежит в файле.
 * <p>
 * {@code extra} хранит поля, которых этот код не знает (их могла дописать более новая версия бота).
 * Узел никогда не меняется после создания записи: при записи в файл берётся копия.
 */
public record LedgerEntry(int basicCount, int premiumCount, Instant createdAt, Instant updatedAt, ObjectNode extra) {

    public LedgerEntry {
        if (basicCount < 0 || premiumCount < 0) {
            throw new IllegalArgumentException("Counters must be non-negative: basic=" + basicCount
                    + ", premium=" + premiumCount);
        }
        extra = extra == null ? JsonNodeFactory.instance.objectNode() : extra;
    }

    public static LedgerEntry fresh(Instant now) {
        return new LedgerEntry(0, 0, now, now, null);
    }

    public LedgerEntry withBasicUsed(Instant now) {
        return new LedgerEntry(Math.addExact(basicCount, 1), premiumCount, createdAt, now, extra);
    }

    public LedgerEntry withPremiumUsed(Instant now) {
        return new LedgerEntry(basicCount, Math.addExact(premiumCount, 1), createdAt, now, extra);
    }
}
