package org.arcanabar.exception;

/**
 * Почему не удалось получить гадание от провайдера.
 */
public enum FailureReason {
    /** Сеть, таймаут, 5xx. */
    NETWORK,
    /** HTTP 429. */
    RATE_LIMIT,
    /** 4xx кроме 429: неверный ключ, неверный запрос. Повторять бессмысленно. */
    PROVIDER_REJECTED,
    /** Ответ пришёл, но не прошёл проверку структуры. */
    SCHEMA_VIOLATION
}
