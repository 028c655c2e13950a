package org.arcanabar.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.arcanabar.repository.LedgerFileStore;
import org.arcanabar.service.UsageLedger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LedgerFileStore ledgerFileStore(QuotaProperties quota, ObjectMapper om) {
        return new LedgerFileStore(quota.ledgerPath(), om);
    }

    // битый файл валит старт приложения: StorageCorruptionException из конструктора
    @Bean
    public UsageLedger usageLedger(LedgerFileStore store, QuotaProperties quota, Clock clock) {
        return new UsageLedger(store, quota, clock);
    }
}
