package org.arcanabar.repository;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Неизменяемый снимок всех счётчиков. Изменение = новый снимок.
 *
 * @param extra неизвестные поля верхнего уровня файла
 */
public record LedgerSnapshot(Map<String, LedgerEntry> users, ObjectNode extra) {

    public LedgerSnapshot {
        users = Collections.unmodifiableMap(new LinkedHashMap<>(users));
        extra = extra == null ? JsonNodeFactory.instance.objectNode() : extra;
    }

    public static LedgerSnapshot empty() {
        return new LedgerSnapshot(Map.of(), null);
    }

    public LedgerEntry find(String userId) {
        return users.get(userId);
    }

    public LedgerSnapshot with(String userId, LedgerEntry entry) {
        var copy = new LinkedHashMap<>(users);
        copy.put(userId, entry);
        return new LedgerSnapshot(copy, extra);
    }
}
