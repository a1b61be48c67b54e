package com.deepansh.rag.memory;

/**
 * One user question with the assistant's answer.
 */
public record Exchange(String user, String assistant) {
}
