package org.arcanabar.exception;

import org.arcanabar.model.ReadingKind;

/**
 * Все попытки исчерпаны (или ошибка не подлежит повтору). Частичного гадания не бывает.
 */
public class GenerationFailedException extends RuntimeException {

    private final ReadingKind kind;
    private final FailureReason reason;
    private final int attempts;
    private final String lastRawPayload;

    public GenerationFailedException(ReadingKind kind, FailureReason reason, int attempts,
                                     String lastRawPayload, Throwable cause) {
        super(kind + " reading failed after " + attempts + " attempt(s): " + reason
                + (cause == null || cause.getMessage() == null ? "" : " (" + cause.getMessage() + ")"), cause);
        this.kind = kind;
        this.reason = reason;
        this.attempts = attempts;
        this.lastRawPayload = lastRawPayload;
    }

    public ReadingKind getKind() {
        return kind;
    }

    public FailureReason getReason() {
        return reason;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getLastRawPayload() {
        return lastRawPayload;
    }
}
