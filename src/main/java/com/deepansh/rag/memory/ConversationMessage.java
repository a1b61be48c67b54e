package com.deepansh.rag.memory;

import com.deepansh.rag.session.TurnMetadata;

import java.time.Instant;

/**
 * One entry of the conversation window. Assistant entries carry the turn's metadata.
 */
public record ConversationMessage(Role role, String content, Instant timestamp, TurnMetadata metadata) {

    public enum Role {
        user, assistant
    }

    public static ConversationMessage user(String content, Instant timestamp) {
        return new ConversationMessage(Role.user, content, timestamp, null);
    }

    public static ConversationMessage assistant(String content, Instant timestamp, TurnMetadata metadata) {
        return new ConversationMessage(Role.assistant, content, timestamp, metadata);
    }

    public boolean isUser() {
        return role == Role.user;
    }
}
