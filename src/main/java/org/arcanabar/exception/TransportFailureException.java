package org.arcanabar.exception;

public class TransportFailureException extends RuntimeException {

    private final FailureReason reason;
    private final Integer httpStatus;
    private final String body;

    public TransportFailureException(FailureReason reason, Integer httpStatus, String message, String body, Throwable cause) {
        super(message, cause);
        if (reason == FailureReason.SCHEMA_VIOLATION) {
            throw new IllegalArgumentException("Schema violations are reported by SchemaViolationException");
        }
        this.reason = reason;
        this.httpStatus = httpStatus;
        this.body = body;
    }

    public static TransportFailureException network(String message, Throwable cause) {
        return new TransportFailureException(FailureReason.NETWORK, null, message, null, cause);
    }

    public FailureReason getReason() {
        return reason;
    }

    /** HTTP-статус ответа провайдера или {@code null}, если ответа не было. */
    public Integer getHttpStatus() {
        return httpStatus;
    }

    public String getBody() {
        return body;
    }

    public boolean isRetryable() {
        return reason != FailureReason.PROVIDER_REJECTED;
    }
}
