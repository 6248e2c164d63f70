package com.tribe.matching.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tribe.matching.config.AdvisoryProperties;
import com.tribe.matching.dto.AdvisoryResult;
import com.tribe.matching.exceptions.AdvisoryUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * Chat-completions client for an OpenRouter-compatible endpoint.
 */
@Slf4j
public class OpenRouterAdvisoryClient implements AdvisoryClient {
    private final RestClient restClient;
    private final AdvisoryProperties properties;

    public OpenRouterAdvisoryClient(RestClient.Builder builder, AdvisoryProperties properties) {
        this.properties = properties;
        this.restClient = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public AdvisoryResult scoreText(String prompt) {
        Map<String, Object> body = Map.of(
                "model", properties.getModel(),
                "messages", List.of(Map.of("role", "user", "content", prompt)),
                "temperature", properties.getTemperature(),
                "max_tokens", properties.getMaxTokens()
        );

        long start = System.currentTimeMillis();
        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new AdvisoryUnavailableException("Advisory request failed: " + e.getMessage(), e);
        }

        String content = response == null ? "" : response.path("choices").path(0).path("message").path("content").asText("");
        log.debug("Advisory response model={}, latencyMs={}, length={}",
                properties.getModel(), System.currentTimeMillis() - start, content.length());
        if (content.isBlank()) {
            throw new AdvisoryUnavailableException("Advisory response was empty");
        }
        return new AdvisoryResult(content, properties.getModel());
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
