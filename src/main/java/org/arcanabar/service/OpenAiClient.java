package org.arcanabar.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.arcanabar.config.AppProperties;
import org.arcanabar.dto.OpenAiDtos;
import org.arcanabar.exception.FailureReason;
import org.arcanabar.exception.SchemaViolationException;
import org.arcanabar.exception.TransportFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.Map;

/**
 * Один вызов Chat Completions, без повторов. Повторы делает {@link ReadingGenerator}.
 * <p>
 * Ошибки транспорта и HTTP превращаются в {@link TransportFailureException},
 * пустой/обрезанный/нечитаемый ответ в {@link SchemaViolationException}.
 */
@Service
public class OpenAiClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiClient.class);

    private final RestClient rc;
    private final AppProperties props;
    private final ObjectMapper om;

    public OpenAiClient(RestClient openAiRestClient, AppProperties props, ObjectMapper om) {
        this.rc = openAiRestClient;
        this.props = props;
        this.om = om;
    }

    static String trunc(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...(truncated)";
    }

    /**
     * Отправляет промпт со Structured Outputs (json_schema) и возвращает текст ассистента.
     */
    public OpenAiDtos.Completion chatJson(OpenAiDtos.ChatPrompt prompt) {
        var p = props.openai();

        var req = Map.of(
                "model", p.chatModel(),
                "max_completion_tokens", p.maxTokens(),
                "temperature", p.temperature(),
                "response_format", Map.of(
                        "type", "json_schema",
                        "json_schema", Map.of("name", prompt.name(), "strict", true, "schema", prompt.schema())
                ),
                "messages", List.of(
                        Map.of("role", "system", "content", prompt.system()),
                        Map.of("role", "user", "content", prompt.user())
                )
        );

        String raw;
        try {
            raw = rc.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(req)
                    .retrieve()
                    .body(String.class);

        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String body = e.getResponseBodyAsString();
            FailureReason reason = classify(status);
            log.error("OpenAI {} HTTP error status={} reason={} body={}", prompt.name(), status, reason, trunc(body, 2000));
            throw new TransportFailureException(reason, status, "HTTP " + status + " from OpenAI", trunc(body, 2000), e);

        } catch (ResourceAccessException e) {
            log.error("OpenAI {} network/timeout error: {}", prompt.name(), e.getMessage());
            throw TransportFailureException.network("Network/timeout: " + e.getMessage(), e);

        } catch (RestClientException e) {
            log.error("OpenAI {} unexpected client error: {}", prompt.name(), e.getMessage());
            throw TransportFailureException.network("Chat call failed: " + e.getMessage(), e);
        }

        if (raw == null || raw.isBlank()) {
            throw new SchemaViolationException("Empty raw response from OpenAI", raw);
        }

        log.debug("OpenAI {} raw response: {}", prompt.name(), trunc(raw, 2000));

        JsonNode root;
        try {
            root = om.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new SchemaViolationException("OpenAI response is not JSON", trunc(raw, 2000), e);
        }

        String finish = root.path("choices").path(0).path("finish_reason").asText(null);
        String content = extractAssistantContent(root);

        if ("length".equals(finish) && (content == null || content.isBlank())) {
            throw new SchemaViolationException(
                    "Model hit token limit before producing visible output. Increase max-tokens.", trunc(raw, 2000));
        }
        if (content == null || content.isBlank()) {
            throw new SchemaViolationException("Empty chat content", trunc(raw, 2000));
        }

        long tokens = root.path("usage").path("total_tokens").asLong(0);
        log.info("OpenAI {} completion: finish_reason={} tokens={}", prompt.name(), finish, tokens);
        return new OpenAiDtos.Completion(content, finish, tokens);
    }

    static FailureReason classify(int status) {
        if (status == HttpStatus.TOO_MANY_REQUESTS.value()) return FailureReason.RATE_LIMIT;
        if (status >= 500 || status == HttpStatus.REQUEST_TIMEOUT.value()) return FailureReason.NETWORK;
        return FailureReason.PROVIDER_REJECTED;
    }

    /**
     * Достаёт текст ассистента из chat.completion ответа.
     * Поддерживает:
     * - content как строка
     * - content как массив частей [{text:"..."}, ...]
     * Отказ модели (refusal) считаем пустым ответом.
     */
    private String extractAssistantContent(JsonNode root) {
        JsonNode msg = root.path("choices").path(0).path("message");
        JsonNode content = msg.path("content");

        if (content.isTextual()) {
            return content.asText();
        }

        if (content.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode part : content) {
                JsonNode t = part.get("text");
                if (t != null && t.isTextual()) sb.append(t.asText());
            }
            String joined = sb.toString().trim();
            if (!joined.isBlank()) return joined;
        }

        JsonNode refusal = msg.get("refusal");
        if (refusal != null && refusal.isTextual()) {
            log.warn("OpenAI refused: {}", trunc(refusal.asText(), 500));
            return "";
        }

        return null;
    }
}
