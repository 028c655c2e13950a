package org.arcanabar.dto;

import java.util.Map;

public class OpenAiDtos {

    /**
     * Один запрос к Chat Completions: промпты и JSON-схема ожидаемого ответа.
     */
    public record ChatPrompt(String name, String system, String user, Map<String, Object> schema) {}

    /**
     * Текст ассистента (должен быть JSON гадания) и сколько токенов ушло.
     */
    public record Completion(String content, String finishReason, long totalTokens) {}
}
