package com.deepansh.rag.llm;

/**
 * Non-retryable LLM failure: bad key, bad request, empty response.
 * Listed in the resilience4j ignore lists so it neither retries nor trips the breaker.
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
