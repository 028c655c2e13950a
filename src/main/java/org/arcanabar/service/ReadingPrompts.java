package org.arcanabar.service;

import org.arcanabar.dto.OpenAiDtos;
import org.arcanabar.model.ReadingKind;

import java.util.List;
import java.util.Map;

/**
 * Промпты и JSON-схемы ответов для обоих видов гадания.
 * <p>
 * Форма ответа общая: {"cards":[...],"interpretation":"...","drinks":[...]};
 * отличается только число карт и напитков (1 и 1 для базового, 3 и 3 для премиум).
 */
final class ReadingPrompts {

    static final String BIRTHDATE_PLACEHOLDER = "{birthdate}";

    private static final String BASIC_SYSTEM = """
            Ты таролог и бармен в одном лице. Вытяни одну случайную карту Таро
            и подбери к ней напиток.

            Верни строго JSON:
            {"cards":[{"name":"...","orientation":"upright|reversed","meaning":"..."}],
             "interpretation":"...",
             "drinks":[{"name":"...","rationale":"..."}]}

            Ровно одна карта и ровно один напиток. orientation только upright или reversed.
            meaning: одно-два предложения о каноническом значении карты.
            rationale: почему напиток подходит к карте.
            Без markdown. Без лишних полей. Пиши по-русски.
            """;

    private static final String BASIC_USER = "Сделай гадание на одной карте.";

    private static final String PREMIUM_SYSTEM = """
            Ты опытный таролог и бармен. Сделай расклад на три карты:
            прошлое, настоящее, будущее (именно в этом порядке).
            Учитывай дату рождения человека.

            Верни строго JSON:
            {"cards":[{"name":"...","orientation":"upright|reversed","meaning":"..."}, ...],
             "interpretation":"...",
             "drinks":[{"name":"...","rationale":"..."}, ...]}

            Ровно три карты и ровно три напитка: i-й напиток к i-й карте.
            orientation только upright или reversed.
            interpretation: общее толкование расклада целиком.
            Без markdown. Без лишних полей. Пиши по-русски.
            """;

    private static final String PREMIUM_USER = "Дата рождения: " + BIRTHDATE_PLACEHOLDER + "\nСделай расклад.";

    private ReadingPrompts() {
    }

    static OpenAiDtos.ChatPrompt basic() {
        return new OpenAiDtos.ChatPrompt("basic_reading", BASIC_SYSTEM, BASIC_USER, schema(ReadingKind.BASIC));
    }

    static OpenAiDtos.ChatPrompt premium(String birthdate) {
        // replace, а не String.format: в промптах есть фигурные скобки JSON
        String user = PREMIUM_USER.replace(BIRTHDATE_PLACEHOLDER, birthdate);
        return new OpenAiDtos.ChatPrompt("premium_reading", PREMIUM_SYSTEM, user, schema(ReadingKind.PREMIUM));
    }

    static Map<String, Object> schema(ReadingKind kind) {
        var card = Map.of(
                "type", "object",
                "additionalProperties", false,
                "properties", Map.of(
                        "name", Map.of("type", "string"),
                        "orientation", Map.of("type", "string", "enum", List.of("upright", "reversed")),
                        "meaning", Map.of("type", "string")
                ),
                "required", List.of("name", "orientation", "meaning")
        );
        var drink = Map.of(
                "type", "object",
                "additionalProperties", false,
                "properties", Map.of(
                        "name", Map.of("type", "string"),
                        "rationale", Map.of("type", "string")
                ),
                "required", List.of("name", "rationale")
        );
        int n = kind.cardCount();
        return Map.of(
                "type", "object",
                "additionalProperties", false,
                "properties", Map.of(
                        "cards", Map.of("type", "array", "items", card, "minItems", n, "maxItems", n),
                        "interpretation", Map.of("type", "string"),
                        "drinks", Map.of("type", "array", "items", drink, "minItems", n, "maxItems", n)
                ),
                "required", List.of("cards", "interpretation", "drinks")
        );
    }
}
