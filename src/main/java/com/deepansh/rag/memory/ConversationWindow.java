package com.deepansh.rag.memory;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded, ordered message sequence of one session.
 *
 * Mutations happen only under the session's lock; every mutation publishes a
 * new immutable list through a volatile field, so lock-free readers always see
 * a complete sequence, never a half-applied append or trim.
 */
class ConversationWindow {

    private volatile List<ConversationMessage> messages = List.of();

    List<ConversationMessage> messages() {
        return messages;
    }

    int size() {
        return messages.size();
    }

    /** Completed user/assistant exchanges currently in the window */
    int turnCount() {
        return messages.size() / 2;
    }

    /**
     * Appends one exchange and evicts from the oldest end beyond maxMessages.
     * Caller must hold the session lock.
     *
     * @return the sequence as it was before the append, for rollback
     */
    List<ConversationMessage> append(ConversationMessage user, ConversationMessage assistant, int maxMessages) {
        List<ConversationMessage> before = messages;
        List<ConversationMessage> next = new ArrayList<>(before.size() + 2);
        next.addAll(before);
        next.add(user);
        next.add(assistant);
        if (next.size() > maxMessages) {
            next = next.subList(next.size() - maxMessages, next.size());
        }
        messages = List.copyOf(next);
        return before;
    }

    /** Caller must hold the session lock. */
    void restore(List<ConversationMessage> previous) {
        messages = previous;
    }
}
