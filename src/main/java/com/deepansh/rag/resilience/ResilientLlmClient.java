package com.deepansh.rag.resilience;

import com.deepansh.rag.llm.GenerationOptions;
import com.deepansh.rag.llm.LlmClient;
import com.deepansh.rag.llm.LlmResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Decorator around the active provider client that adds retry + circuit breaker.
 *
 * No fallback method here: the summarizer owns the degraded path (heuristic
 * summary, nothing cached), so the final exception must reach it.
 *
 * Retry / circuit breaker config lives in application.yml under the
 * "summarizer" instance. LlmException is ignored by both, so a bad key or
 * a rejected model fails fast without opening the circuit.
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "summarizer")
    @CircuitBreaker(name = "summarizer")
    public LlmResponse generate(String prompt, GenerationOptions options) {
        return delegate.generate(prompt, options);
    }
}
