package com.ai.concierge.controller;

import com.ai.concierge.client.CompletionClient;
import com.ai.concierge.component.SessionRegistry;
import com.ai.concierge.dto.ChatRequest;
import com.ai.concierge.dto.ChatResponse;
import com.ai.concierge.dto.ClearSessionRequest;
import com.ai.concierge.service.ConversationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api")
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    private final ConversationOrchestrator orchestrator;
    private final SessionRegistry sessions;
    private final CompletionClient completionClient;

    public ChatController(ConversationOrchestrator orchestrator, SessionRegistry sessions, CompletionClient completionClient) {
        this.orchestrator = orchestrator;
        this.sessions = sessions;
        this.completionClient = completionClient;
    }

    @PostMapping(value = "/chat", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> chat(@RequestBody ChatRequest request) {
        if (request == null || !StringUtils.hasText(request.getQuestion())) {
            return ResponseEntity.badRequest().body(Map.of("error", "question must not be empty"));
        }
        String sessionId = sessionIdOf(request);
        ChatResponse response = orchestrator.process(sessionId, request.getQuestion(), request.getK(), request.getMaxNewTokens());
        log.info("[{}] {} reply ({} sources)", sessionId, response.getType(), response.getSources().size());
        return ResponseEntity.ok(response);
    }

    /** Streams the answer as plain UTF-8 text chunks. */
    @PostMapping(value = "/chat/stream", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<StreamingResponseBody> stream(@RequestBody ChatRequest request) {
        if (request == null || !StringUtils.hasText(request.getQuestion())) {
            return ResponseEntity.badRequest().build();
        }
        String sessionId = sessionIdOf(request);
        StreamingResponseBody body = out -> orchestrator.stream(sessionId, request.getQuestion(), request.getK(),
                request.getMaxNewTokens(), chunk -> write(out, chunk));
        return ResponseEntity.ok()
                .header("X-Session-Id", sessionId)
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .body(body);
    }

    @PostMapping("/chat/clear")
    public Map<String, String> clear(@RequestBody ClearSessionRequest request) {
        String sessionId = request == null ? null : request.getSessionId();
        if (!StringUtils.hasText(sessionId)) {
            return Map.of("status", "error", "message", "session_id is required");
        }
        boolean cleared = sessions.clear(sessionId);
        return cleared
                ? Map.of("status", "success", "message", "Session " + sessionId + " cleared")
                : Map.of("status", "not_found", "message", "Session " + sessionId + " not found");
    }

    @DeleteMapping("/chat/sessions/{sessionId}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String sessionId) {
        if (!sessions.delete(sessionId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("status", "not_found", "message", "Session " + sessionId + " not found"));
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "message", "Session " + sessionId + " deleted"));
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", "ok");
        out.put("sessions", sessions.size());
        out.put("completion_configured", completionClient.isConfigured());
        return out;
    }

    private static String sessionIdOf(ChatRequest request) {
        return StringUtils.hasText(request.getSessionId()) ? request.getSessionId().trim() : UUID.randomUUID().toString();
    }

    private static void write(OutputStream out, String chunk) {
        try {
            out.write(chunk.getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Client stream closed", e);
        }
    }
}
