package com.deepansh.rag.llm;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Factory that creates the summary LLM client based on LLM_PROVIDER env var.
 * Sampling settings (temperature, max tokens) come from rag.session.summary,
 * so only connection details live per provider.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:groq}")
    private String provider;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url:https://api.openai.com/v1}") private String openAiBaseUrl;
    @Value("${openai.model:gpt-4o-mini}") private String openAiModel;

    // Groq
    @Value("${groq.api-key:}") private String groqKey;
    @Value("${groq.base-url:https://api.groq.com/openai/v1}") private String groqBaseUrl;
    @Value("${groq.model:llama-3.1-8b-instant}") private String groqModel;

    // Gemini (OpenAI-compatible endpoint)
    @Value("${gemini.api-key:}") private String geminiKey;
    @Value("${gemini.base-url:https://generativelanguage.googleapis.com/v1beta/openai}") private String geminiBaseUrl;
    @Value("${gemini.model:gemini-2.0-flash-lite}") private String geminiModel;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Summary LLM Provider : {}", provider.toUpperCase());
        log.info("  Default model        : {}", activeProps().getDefaultModel());
        log.info("================================================================");
    }

    /**
     * The raw provider client. ResilientLlmClient wraps it with retry + circuit breaker.
     */
    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(RestClient.Builder builder) {
        LlmProviderProperties props = activeProps();
        switch (props.getName()) {
            case "openai" -> logKey("OPENAI", openAiKey, "OPENAI_API_KEY", "https://platform.openai.com/api-keys");
            case "gemini" -> logKey("GEMINI", geminiKey, "GEMINI_API_KEY", "https://aistudio.google.com/app/apikey");
            default -> logKey("GROQ", groqKey, "GROQ_API_KEY", "https://console.groq.com/keys");
        }
        return new GenericLlmClient(props, builder.clone());
    }

    LlmProviderProperties activeProps() {
        return switch (provider.toLowerCase()) {
            case "openai" -> props("openai", openAiKey, openAiBaseUrl, openAiModel);
            case "gemini" -> props("gemini", geminiKey, geminiBaseUrl, geminiModel);
            default -> props("groq", groqKey, groqBaseUrl, groqModel);
        };
    }

    private static LlmProviderProperties props(String name, String key, String baseUrl, String model) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setName(name); p.setApiKey(key); p.setBaseUrl(baseUrl); p.setDefaultModel(model);
        return p;
    }

    private void logKey(String name, String key, String envVar, String signupUrl) {
        if (key == null || key.isBlank()) {
            // Not fatal: summaries fall back to the heuristic line
            log.warn("  {} API key not set, summaries will use the heuristic fallback. Set env var: {}",
                    name, envVar);
            log.warn("  Get a key at: {}", signupUrl);
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
