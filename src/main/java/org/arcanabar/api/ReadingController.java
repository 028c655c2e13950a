package org.arcanabar.api;

import org.arcanabar.dto.ApiException;
import org.arcanabar.dto.BasicReadingResponse;
import org.arcanabar.dto.StatsResponse;
import org.arcanabar.dto.UsageResponse;
import org.arcanabar.model.BasicReading;
import org.arcanabar.model.ReadingOutcome;
import org.arcanabar.service.GenerationStats;
import org.arcanabar.service.ReadingService;
import org.arcanabar.service.UsageLedger;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * HTTP-вход для чат-слоя, живущего в другом процессе.
 * Премиум-гадание сюда не выведено: его вызывает платёжный слой напрямую через {@link ReadingService}.
 */
@RestController
@RequestMapping("/api/v1")
public class ReadingController {

    private final ReadingService readings;
    private final UsageLedger ledger;
    private final GenerationStats stats;

    public ReadingController(ReadingService readings, UsageLedger ledger, GenerationStats stats) {
        this.readings = readings;
        this.ledger = ledger;
        this.stats = stats;
    }

    // --- HEALTH ---------------------------------------------------------------

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of("status", "ok");
    }

    // --- BASIC READING --------------------------------------------------------

    @PostMapping(value = "/readings/basic", produces = MediaType.APPLICATION_JSON_VALUE)
    public BasicReadingResponse basicReading(
            @RequestHeader(value = "X-User-Id", required = false) String userId
    ) {
        String id = requireUserId(userId);

        ReadingOutcome<BasicReading> outcome = readings.basicReading(id);

        return new BasicReadingResponse(
                UUID.randomUUID().toString(),
                outcome.reading(),
                UsageResponse.of(outcome.usage(), ledger.freeLimit(), ledger.remaining(id))
        );
    }

    // --- USAGE ----------------------------------------------------------------

    @GetMapping(value = "/usage/{userId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public UsageResponse usage(@PathVariable String userId) {
        String id = requireUserId(userId);
        return UsageResponse.of(ledger.get(id), ledger.freeLimit(), ledger.remaining(id));
    }

    // --- STATS ----------------------------------------------------------------

    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public StatsResponse stats() {
        return stats.snapshot();
    }

    // --- HELPERS --------------------------------------------------------------

    private String requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw ApiException.badRequest("USER_ID_MISSING", "X-User-Id header is required");
        }
        return userId.trim();
    }
}
