package org.arcanabar.dto;

import org.arcanabar.model.UsageRecord;

import java.util.OptionalInt;

/**
 * @param remaining сколько бесплатных гаданий осталось; {@code null} для пользователей без лимита
 */
public record UsageResponse(
        String userId,
        int basicCount,
        int premiumCount,
        boolean unlimited,
        int freeLimit,
        Integer remaining,
        String updatedAt
) {
    public static UsageResponse of(UsageRecord r, int freeLimit, OptionalInt remaining) {
        return new UsageResponse(
                r.userId(),
                r.basicCount(),
                r.premiumCount(),
                r.unlimited(),
                freeLimit,
                remaining.isPresent() ? remaining.getAsInt() : null,
                r.updatedAt() == null ? null : r.updatedAt().toString()
        );
    }
}
