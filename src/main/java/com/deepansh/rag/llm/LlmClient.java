package com.deepansh.rag.llm;

public interface LlmClient {

    /**
     * Single-prompt text generation.
     *
     * @param prompt  complete prompt text, sent as one user message
     * @param options sampling settings; a null model means the provider's default
     * @return the generated text and token usage
     * @throws LlmException when the provider rejects the request or returns nothing usable
     */
    LlmResponse generate(String prompt, GenerationOptions options);
}
