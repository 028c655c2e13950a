package org.arcanabar.model;

/**
 * Готовое гадание и состояние счётчиков пользователя после него.
 */
public record ReadingOutcome<T>(T reading, UsageRecord usage) {}
