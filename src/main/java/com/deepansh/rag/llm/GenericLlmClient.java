package com.deepansh.rag.llm;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat-completions client: works with Groq, OpenAI, and Gemini.
 * Used by the session engine only for conversation summaries.
 *
 * Error handling strategy:
 *
 * | Error                  | Action                                        |
 * |------------------------|-----------------------------------------------|
 * | 401 invalid_api_key    | LlmException (not retried, not CB failure)    |
 * | 429 rate limit         | RuntimeException (retried)                    |
 * | 400 other              | LlmException (not retried, not CB failure)    |
 * | 5xx server error       | RuntimeException (retried, counts as failure) |
 * | network error          | ResourceAccessException (retried)             |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props, RestClient.Builder restClientBuilder) {
        this.props = props;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse generate(String prompt, GenerationOptions options) {
        Map<String, Object> requestBody = buildRequestBody(prompt, options);
        String providerName = props.getName();

        log.debug("Sending prompt to {} [model={}, chars={}]",
                providerName, requestBody.get("model"), prompt.length());

        Map<String, Object> response = restClient.post()
                .uri("/chat/completions")
                .body(requestBody)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                    handle4xxError(body, res.getStatusCode().value());
                })
                .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                    // 5xx IS retryable: RuntimeException (not LlmException)
                    throw new RuntimeException(
                        providerName + " server error [" + res.getStatusCode() + "]: " + body);
                })
                .body(new ParameterizedTypeReference<>() {});

        return parseResponse(response);
    }

    /**
     * Maps 4xx codes to exception types so retry and circuit breaker treat
     * configuration errors differently from transient ones.
     */
    private void handle4xxError(String body, int statusCode) {
        String providerName = props.getName();

        if (statusCode == 401) {
            throw new LlmException(
                providerName + " API key is invalid. Check your " +
                providerName.toUpperCase() + "_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            throw new RuntimeException(providerName + " rate limit exceeded. Will retry.");
        }

        if (body.contains("model_decommissioned") || body.contains("model_not_found")) {
            throw new LlmException(providerName + " rejected the configured summary model: " + body);
        }

        throw new LlmException(providerName + " client error [" + statusCode + "]: " + body);
    }

    private Map<String, Object> buildRequestBody(String prompt, GenerationOptions options) {
        String model = options.model() != null && !options.model().isBlank()
                ? options.model()
                : props.getDefaultModel();

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("max_tokens", options.maxTokens());
        body.put("temperature", options.temperature());
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        return body;
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        if (response == null) {
            throw new LlmException(props.getName() + " returned an empty body");
        }
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new LlmException(props.getName() + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        String content = message != null ? (String) message.get("content") : null;

        return LlmResponse.builder()
                .content(content)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }
}
