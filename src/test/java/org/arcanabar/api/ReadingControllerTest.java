package org.arcanabar.api;

import org.arcanabar.exception.FailureReason;
import org.arcanabar.exception.GenerationFailedException;
import org.arcanabar.exception.LedgerWriteException;
import org.arcanabar.exception.QuotaExceededException;
import org.arcanabar.exception.TransportFailureException;
import org.arcanabar.model.BasicReading;
import org.arcanabar.model.Card;
import org.arcanabar.model.Drink;
import org.arcanabar.model.Orientation;
import org.arcanabar.model.ReadingKind;
import org.arcanabar.model.ReadingOutcome;
import org.arcanabar.model.UsageRecord;
import org.arcanabar.service.GenerationStats;
import org.arcanabar.service.ReadingService;
import org.arcanabar.service.UsageLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.OptionalInt;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ReadingControllerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    private ReadingService readings;

    @Mock
    private UsageLedger ledger;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        var controller = new ReadingController(readings, ledger, new GenerationStats());
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void health() throws Exception {
        mvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void basicReadingReturnsReadingAndUsage() throws Exception {
        var reading = new BasicReading(new Card("Маг", Orientation.UPRIGHT, "воля"), new Drink("Мартини", "ясность"), "сегодня получится");
        when(readings.basicReading("42")).thenReturn(
                new ReadingOutcome<>(reading, new UsageRecord("42", 1, 0, false, NOW, NOW)));
        when(ledger.freeLimit()).thenReturn(3);
        when(ledger.remaining("42")).thenReturn(OptionalInt.of(2));

        mvc.perform(post("/api/v1/readings/basic").header("X-User-Id", "42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.readingId").isNotEmpty())
                .andExpect(jsonPath("$.reading.card.name").value("Маг"))
                .andExpect(jsonPath("$.reading.card.orientation").value("UPRIGHT"))
                .andExpect(jsonPath("$.reading.drink.name").value("Мартини"))
                .andExpect(jsonPath("$.usage.basicCount").value(1))
                .andExpect(jsonPath("$.usage.remaining").value(2))
                .andExpect(jsonPath("$.usage.updatedAt").value(NOW.toString()));
    }

    @Test
    void missingUserIdIsBadRequest() throws Exception {
        mvc.perform(post("/api/v1/readings/basic"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("USER_ID_MISSING"))
                .andExpect(jsonPath("$.error.requestId").isNotEmpty());
        verifyNoInteractions(readings);
    }

    @Test
    void quotaExceededIs429() throws Exception {
        when(readings.basicReading("42")).thenThrow(new QuotaExceededException("42", 3, 3));

        mvc.perform(post("/api/v1/readings/basic").header("X-User-Id", "42"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error.code").value("QUOTA_EXCEEDED"))
                .andExpect(jsonPath("$.error.details.userId").value("42"))
                .andExpect(jsonPath("$.error.details.limit").value(3));
    }

    @Test
    void generationFailureIs502WithReason() throws Exception {
        when(readings.basicReading("42")).thenThrow(
                new GenerationFailedException(ReadingKind.BASIC, FailureReason.RATE_LIMIT, 3, "{}", null));

        mvc.perform(post("/api/v1/readings/basic").header("X-User-Id", "42"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error.code").value("GENERATION_FAILED"))
                .andExpect(jsonPath("$.error.details.reason").value("RATE_LIMIT"))
                .andExpect(jsonPath("$.error.details.attempts").value(3))
                .andExpect(jsonPath("$.error.details.providerStatus").doesNotExist());
    }

    @Test
    void rejectedGenerationCarriesProviderStatus() throws Exception {
        var rejected = new TransportFailureException(FailureReason.PROVIDER_REJECTED, 401, "HTTP 401 from OpenAI", "{}", null);
        when(readings.basicReading("42")).thenThrow(
                new GenerationFailedException(ReadingKind.BASIC, FailureReason.PROVIDER_REJECTED, 1, "{}", rejected));

        mvc.perform(post("/api/v1/readings/basic").header("X-User-Id", "42"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error.details.reason").value("PROVIDER_REJECTED"))
                .andExpect(jsonPath("$.error.details.providerStatus").value(401));
    }

    @Test
    void ledgerWriteFailureIs500() throws Exception {
        when(readings.basicReading("42")).thenThrow(
                new LedgerWriteException(Path.of("data/users.json"), new IOException("disk full")));

        mvc.perform(post("/api/v1/readings/basic").header("X-User-Id", "42"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error.code").value("LEDGER_WRITE_FAILED"));
    }

    @Test
    void usageForAllowListedUserHasNoRemaining() throws Exception {
        when(ledger.get("7")).thenReturn(new UsageRecord("7", 10, 2, true, NOW, NOW));
        when(ledger.freeLimit()).thenReturn(3);
        when(ledger.remaining("7")).thenReturn(OptionalInt.empty());

        mvc.perform(get("/api/v1/usage/7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unlimited").value(true))
                .andExpect(jsonPath("$.basicCount").value(10))
                .andExpect(jsonPath("$.premiumCount").value(2))
                .andExpect(jsonPath("$.remaining").doesNotExist());
    }

    @Test
    void statsStartAtZero() throws Exception {
        mvc.perform(get("/api/v1/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRequests").value(0))
                .andExpect(jsonPath("$.failuresByReason.SCHEMA_VIOLATION").value(0));
    }
}
