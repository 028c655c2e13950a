package org.arcanabar.exception;

/**
 * Модель ответила, но JSON не соответствует ожидаемой структуре гадания.
 */
public class SchemaViolationException extends RuntimeException {

    private final String rawPayload;

    public SchemaViolationException(String message, String rawPayload) {
        this(message, rawPayload, null);
    }

    public SchemaViolationException(String message, String rawPayload, Throwable cause) {
        super(message, cause);
        this.rawPayload = rawPayload;
    }

    public String getRawPayload() {
        return rawPayload;
    }
}
