package com.deepansh.rag.memory;

import java.util.List;

public record ChatHistory(List<ChatHistoryEntry> messages, int messageCount) {

    public static ChatHistory empty() {
        return new ChatHistory(List.of(), 0);
    }
}
