package org.arcanabar.service;

import org.arcanabar.exception.QuotaExceededException;
import org.arcanabar.model.BasicReading;
import org.arcanabar.model.PremiumReading;
import org.arcanabar.model.ReadingOutcome;
import org.arcanabar.model.UsageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Порядок вызовов для чат-слоя: проверить лимит, сгенерировать, и только после успеха списать.
 * Ошибка генерации ничего не списывает.
 */
@Service
public class ReadingService {

    private static final Logger log = LoggerFactory.getLogger(ReadingService.class);

    private final ReadingGenerator generator;
    private final UsageLedger ledger;

    public ReadingService(ReadingGenerator generator, UsageLedger ledger) {
        this.generator = generator;
        this.ledger = ledger;
    }

    public ReadingOutcome<BasicReading> basicReading(String userId) {
        if (!ledger.mayConsume(userId)) {
            UsageRecord usage = ledger.get(userId);
            log.info("User {} reached the free limit: used={} limit={}", usage.userId(), usage.basicCount(), ledger.freeLimit());
            throw new QuotaExceededException(usage.userId(), ledger.freeLimit(), usage.basicCount());
        }

        BasicReading reading = generator.generateBasic();
        UsageRecord usage = ledger.recordConsumption(userId);
        log.info("Basic reading served to user {}: card={}, used={}", usage.userId(), reading.card().name(), usage.basicCount());
        return new ReadingOutcome<>(reading, usage);
    }

    /**
     * Вызывается платёжным слоем после подтверждённой оплаты. Бесплатный лимит не проверяется.
     */
    public ReadingOutcome<PremiumReading> premiumReading(String userId, String birthdate) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        PremiumReading reading = generator.generatePremium(birthdate);
        UsageRecord usage = ledger.recordPremium(userId);
        log.info("Premium reading served to user {}: premiumCount={}", usage.userId(), usage.premiumCount());
        return new ReadingOutcome<>(reading, usage);
    }
}
