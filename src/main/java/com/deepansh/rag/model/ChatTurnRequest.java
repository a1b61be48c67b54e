package com.deepansh.rag.model;

import com.deepansh.rag.session.TurnMetadata;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ChatTurnRequest {

    @NotBlank(message = "userMessage must not be blank")
    private String userMessage;

    @NotBlank(message = "assistantMessage must not be blank")
    private String assistantMessage;

    /** Optional: tokens, timing, model, topic, debug trace of this turn */
    private TurnMetadata metadata;
}
