package com.deepansh.rag.session;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Per-turn statistics recorded alongside each user/assistant exchange.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TurnMetadata {

    private String messageId;

    @JsonDeserialize(using = LegacyInstantDeserializer.class)
    private Instant timestamp;

    @Builder.Default
    private int tokensUsed = 0;

    /** Seconds spent producing the answer */
    @Builder.Default
    private double processingTime = 0.0;

    private Map<String, Object> modelInfo;

    private String topic;

    private List<String> sources;

    /** Retrieval/generation trace captured for admin debugging */
    private Map<String, Object> debugTrace;
}
