package org.arcanabar.dto;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;
    private final Map<String, Object> details;

    public ApiException(HttpStatus status, String code, String message, Map<String, Object> details) {
        super(message);
        this.status = status;
        this.code = code;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    // удобные фабрики
    public static ApiException badRequest(String code, String message) {
        return new ApiException(HttpStatus.BAD_REQUEST, code, message, Map.of());
    }

    public static ApiException tooManyRequests(String code, String message, Map<String, Object> details) {
        return new ApiException(HttpStatus.TOO_MANY_REQUESTS, code, message, details);
    }

    public static ApiException badGateway(String code, String message, Map<String, Object> details) {
        return new ApiException(HttpStatus.BAD_GATEWAY, code, message, details);
    }
}
