package org.arcanabar.api;

import org.arcanabar.dto.ApiException;
import org.arcanabar.dto.ErrorResponse;
import org.arcanabar.exception.GenerationFailedException;
import org.arcanabar.exception.LedgerWriteException;
import org.arcanabar.exception.QuotaExceededException;
import org.arcanabar.exception.TransportFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApi(ApiException e) {
        log.warn("API error {}: {}", e.getCode(), e.getMessage());
        return render(e);
    }

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<ErrorResponse> handleQuota(QuotaExceededException e) {
        return render(ApiException.tooManyRequests("QUOTA_EXCEEDED", "Free readings are used up",
                Map.of("userId", e.getUserId(), "limit", e.getLimit(), "used", e.getUsed())));
    }

    // пользователю показываем "попробуйте позже", детали только в логах и details
    @ExceptionHandler(GenerationFailedException.class)
    public ResponseEntity<ErrorResponse> handleGeneration(GenerationFailedException e) {
        log.error("Generation failed: {}", e.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", e.getReason().name());
        details.put("attempts", e.getAttempts());
        if (e.getCause() instanceof TransportFailureException tf && tf.getHttpStatus() != null) {
            details.put("providerStatus", tf.getHttpStatus());
        }
        return render(ApiException.badGateway("GENERATION_FAILED", "The cards are silent, try again later", details));
    }

    @ExceptionHandler(LedgerWriteException.class)
    public ResponseEntity<ErrorResponse> handleLedgerWrite(LedgerWriteException e) {
        log.error("Ledger write to {} failed", e.getFile(), e);
        return render(new ApiException(HttpStatus.INTERNAL_SERVER_ERROR, "LEDGER_WRITE_FAILED",
                "Usage could not be saved", Map.of()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return render(ApiException.badRequest("BAD_REQUEST", e.getMessage()));
    }

    private static ResponseEntity<ErrorResponse> render(ApiException e) {
        var body = new ErrorResponse(new ErrorResponse.ErrorBody(
                e.getCode(), e.getMessage(), UUID.randomUUID().toString(), e.getDetails()));
        return ResponseEntity.status(e.getStatus()).body(body);
    }
}
