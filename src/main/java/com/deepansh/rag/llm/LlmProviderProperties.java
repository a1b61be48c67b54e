package com.deepansh.rag.llm;

import lombok.Data;

/**
 * Connection and default sampling settings of one OpenAI-compatible provider
 * (openai / groq / gemini), read from application.yml.
 */
@Data
public class LlmProviderProperties {
    /** Provider name used in logs and error messages */
    private String name;
    private String apiKey;
    private String baseUrl;
    /** Used when the caller does not pick a model */
    private String defaultModel;
}
