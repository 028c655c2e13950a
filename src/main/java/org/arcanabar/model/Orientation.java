package org.arcanabar.model;

import java.util.Locale;
import java.util.Optional;

public enum Orientation {
    UPRIGHT,
    REVERSED;

    /**
     * Модель пишет положение как ей вздумается: "upright", "Reversed", "прямое", "перевёрнутое".
     */
    public static Optional<Orientation> parse(String value) {
        if (value == null) return Optional.empty();
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "upright", "прямое", "прямая" -> Optional.of(UPRIGHT);
            case "reversed", "перевернутое", "перевёрнутое", "перевернутая", "перевёрнутая" -> Optional.of(REVERSED);
            default -> Optional.empty();
        };
    }
}
