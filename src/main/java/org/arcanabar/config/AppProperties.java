package org.arcanabar.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app")
public record AppProperties(OpenAi openai, Generation generation) {

    public AppProperties {
        if (generation == null) generation = Generation.defaults();
    }

    public record OpenAi(
            String apiKey,
            String baseUrl,
            String chatModel,
            int maxTokens,
            double temperature,
            int connectTimeoutMs,
            int timeoutMs
    ) {
        public OpenAi {
            if (chatModel == null || chatModel.isBlank()) chatModel = "gpt-4o-mini";
            if (maxTokens <= 0) maxTokens = 2000;
            if (connectTimeoutMs <= 0) connectTimeoutMs = 5_000;
            if (timeoutMs <= 0) timeoutMs = 60_000;
        }
    }

    /**
     * Политика повторов и таймаутов генерации.
     *
     * @param maxAttempts    общее число попыток, включая первую
     * @param backoffBaseMs  задержка перед второй попыткой, дальше удваивается
     * @param backoffMaxMs   потолок задержки
     * @param callTimeoutMs  общий лимит на асинхронный вызов (все попытки вместе)
     * @param executorThreads размер пула для асинхронных вызовов
     */
    public record Generation(
            int maxAttempts,
            long backoffBaseMs,
            long backoffMaxMs,
            long callTimeoutMs,
            int executorThreads
    ) {
        public Generation {
            if (maxAttempts <= 0) maxAttempts = 3;
            if (backoffBaseMs <= 0) backoffBaseMs = 2_000;
            if (backoffMaxMs < backoffBaseMs) backoffMaxMs = Math.max(10_000, backoffBaseMs);
            if (callTimeoutMs <= 0) callTimeoutMs = 180_000;
            if (executorThreads <= 0) executorThreads = 8;
        }

        public static Generation defaults() {
            return new Generation(3, 2_000, 10_000, 180_000, 8);
        }

        public Duration callTimeout() {
            return Duration.ofMillis(callTimeoutMs);
        }
    }
}
