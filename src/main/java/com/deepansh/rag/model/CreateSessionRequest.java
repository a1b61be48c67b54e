package com.deepansh.rag.model;

import lombok.Data;

import java.util.Map;

@Data
public class CreateSessionRequest {

    /**
     * Optional: if already taken, a different ID is assigned.
     * Always read the ID back from the response.
     */
    private String sessionId;

    /** Client hints such as user_agent */
    private Map<String, Object> metadata;
}
