package org.arcanabar.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Лимит бесплатных гаданий и список пользователей без ограничений.
 * <p>
 * {@code unlimitedUsers} приходит строкой через запятую (FREE_USERS), Spring сам режет её на элементы.
 */
@ConfigurationProperties(prefix = "quota")
public record QuotaProperties(int freeLimit, Set<String> unlimitedUsers, String ledgerFile) {

    public QuotaProperties {
        if (freeLimit < 0) {
            throw new IllegalStateException("quota.free-limit must be >= 0, got " + freeLimit);
        }
        unlimitedUsers = unlimitedUsers == null ? Set.of() : unlimitedUsers.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        if (ledgerFile == null || ledgerFile.isBlank()) ledgerFile = "data/users.json";
    }

    public boolean isUnlimited(String userId) {
        return userId != null && unlimitedUsers.contains(userId);
    }

    public Path ledgerPath() {
        return Path.of(ledgerFile);
    }
}
