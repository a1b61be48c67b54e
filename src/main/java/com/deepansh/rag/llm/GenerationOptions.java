package com.deepansh.rag.llm;

public record GenerationOptions(String model, double temperature, int maxTokens) {
}
