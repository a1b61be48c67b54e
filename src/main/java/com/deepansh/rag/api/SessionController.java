package com.deepansh.rag.api;

import com.deepansh.rag.core.SessionFacade;
import com.deepansh.rag.memory.ChatHistory;
import com.deepansh.rag.memory.Exchange;
import com.deepansh.rag.model.ChatTurnRequest;
import com.deepansh.rag.model.CreateSessionRequest;
import com.deepansh.rag.model.SessionResponse;
import com.deepansh.rag.session.SessionCreation;
import com.deepansh.rag.session.SessionStats;
import com.deepansh.rag.session.TurnMetadata;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Session lifecycle and conversation endpoints.
 *
 * Invalid sessions are not errors on the read endpoints: GET /{id} reports
 * NOT_FOUND / EXPIRED in the body so the client can start a new session.
 * Only POST /{id}/turns fails hard (404 invalid session, 503 persistence failure).
 */
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final SessionFacade sessionFacade;

    // ─── Lifecycle ───────────────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<SessionCreation> create(@RequestBody(required = false) CreateSessionRequest request) {
        CreateSessionRequest body = request != null ? request : new CreateSessionRequest();
        SessionCreation created = sessionFacade.createSession(body.getMetadata(), body.getSessionId());
        log.info("Session create request [requested={}, assigned={}]", body.getSessionId(), created.sessionId());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionResponse> get(@PathVariable String sessionId,
                                               @RequestParam Map<String, String> context) {
        Map<String, Object> merged = context.isEmpty() ? null : new HashMap<>(context);
        return ResponseEntity.ok(SessionResponse.from(sessionId, sessionFacade.getSession(sessionId, merged)));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String sessionId) {
        sessionFacade.deleteSession(sessionId);
        return ResponseEntity.ok(Map.of("message", "Deleted", "sessionId", sessionId));
    }

    @GetMapping("/stats")
    public ResponseEntity<SessionStats> stats() {
        return ResponseEntity.ok(sessionFacade.stats());
    }

    @PostMapping("/clear-expired")
    public ResponseEntity<Map<String, Integer>> clearExpired() {
        return ResponseEntity.ok(Map.of("removed", sessionFacade.clearExpired()));
    }

    // ─── Conversation ────────────────────────────────────────────────────────

    @PostMapping("/{sessionId}/turns")
    public ResponseEntity<TurnMetadata> addTurn(@PathVariable String sessionId,
                                                @Valid @RequestBody ChatTurnRequest request) {
        TurnMetadata stored = sessionFacade.addTurn(sessionId,
                request.getUserMessage(), request.getAssistantMessage(), request.getMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(stored);
    }

    @GetMapping("/{sessionId}/context")
    public ResponseEntity<Map<String, String>> context(@PathVariable String sessionId) {
        return ResponseEntity.ok(Map.of("context", sessionFacade.contextString(sessionId)));
    }

    @GetMapping("/{sessionId}/history")
    public ResponseEntity<ChatHistory> history(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionFacade.chatHistory(sessionId));
    }

    @GetMapping("/{sessionId}/exchanges")
    public ResponseEntity<List<Exchange>> exchanges(@PathVariable String sessionId,
                                                    @RequestParam(defaultValue = "5") int n) {
        return ResponseEntity.ok(sessionFacade.recentExchanges(sessionId, n));
    }

    @GetMapping("/{sessionId}/messages/{messageId}/trace")
    public ResponseEntity<Map<String, Object>> debugTrace(@PathVariable String sessionId,
                                                          @PathVariable String messageId) {
        return sessionFacade.debugTrace(sessionId, messageId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
