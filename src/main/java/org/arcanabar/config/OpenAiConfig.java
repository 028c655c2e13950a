package org.arcanabar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class OpenAiConfig {

    @Bean
    public RestClient openAiRestClient(AppProperties props, RestClient.Builder builder) {
        if (props == null || props.openai() == null) {
            throw new IllegalStateException("Missing config: app.openai.* in application.yml");
        }
        var p = props.openai();

        if (p.baseUrl() == null || p.baseUrl().isBlank()) {
            throw new IllegalStateException("Missing config: app.openai.baseUrl");
        }
        if (p.apiKey() == null || p.apiKey().isBlank()) {
            throw new IllegalStateException("Missing config: app.openai.apiKey");
        }

        // read timeout ограничивает одну попытку; зависшая попытка съедает один retry
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(p.connectTimeoutMs()))
                .build();
        var requestFactory = new JdkClientHttpRequestFactory(http);
        requestFactory.setReadTimeout(Duration.ofMillis(p.timeoutMs()));

        return builder
                .baseUrl(p.baseUrl())
                .defaultHeader("Authorization", "Bearer " + p.apiKey())
                .requestFactory(requestFactory)
                .build();
    }
}
