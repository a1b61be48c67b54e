package com.deepansh.rag.model;

import com.deepansh.rag.session.InvalidReason;
import com.deepansh.rag.session.SessionLookup;
import com.deepansh.rag.session.SessionRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionResponse {

    private String sessionId;
    private boolean valid;
    private InvalidReason reason;
    private long remainingTtlSeconds;
    private long idleSeconds;
    private SessionRecord session;

    public static SessionResponse from(String sessionId, SessionLookup lookup) {
        return SessionResponse.builder()
                .sessionId(sessionId)
                .valid(lookup.isValid())
                .reason(lookup.reason())
                .remainingTtlSeconds(lookup.remainingTtl().toSeconds())
                .idleSeconds(lookup.idleTime().toSeconds())
                .session(lookup.record())
                .build();
    }
}
