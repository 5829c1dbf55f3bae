package com.adlanda.projectorchestrator.controller;

import com.adlanda.projectorchestrator.config.WorkspaceProperties;
import com.adlanda.projectorchestrator.exception.NoActiveProjectException;
import com.adlanda.projectorchestrator.manager.ConversationContextManager;
import com.adlanda.projectorchestrator.model.ConversationMessage;
import com.adlanda.projectorchestrator.model.MessageRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for the active project's conversation context.
 */
@RestController
@RequestMapping("/api/v1/context")
public class ContextController {

    private final ConversationContextManager contextManager;
    private final int defaultMaxChars;

    public ContextController(ConversationContextManager contextManager, WorkspaceProperties properties) {
        this.contextManager = contextManager;
        this.defaultMaxChars = properties.getContext().getMaxContextChars();
    }

    @GetMapping("/messages")
    public ResponseEntity<?> messages() {
        try {
            return ResponseEntity.ok(Map.of(
                    "projectId", contextManager.current().orElse("none"),
                    "messages", contextManager.getMessages()
            ));
        } catch (NoActiveProjectException e) {
            return conflict(e);
        }
    }

    @PostMapping("/messages")
    public ResponseEntity<?> addMessage(@Valid @RequestBody MessageRequest request) {
        try {
            ConversationMessage message = contextManager.addMessage(request.role(), request.content());
            return ResponseEntity.status(HttpStatus.CREATED).body(message);
        } catch (NoActiveProjectException e) {
            return conflict(e);
        }
    }

    @DeleteMapping("/messages")
    public ResponseEntity<?> clear() {
        try {
            contextManager.clear();
            return ResponseEntity.noContent().build();
        } catch (NoActiveProjectException e) {
            return conflict(e);
        }
    }

    /**
     * GET /api/v1/context/recent: Recent messages as model input text.
     */
    @GetMapping("/recent")
    public ResponseEntity<?> recent(@RequestParam(required = false) Integer maxChars) {
        try {
            String context = contextManager.recentContext(maxChars != null ? maxChars : defaultMaxChars);
            return ResponseEntity.ok(Map.of(
                    "projectId", contextManager.current().orElse("none"),
                    "context", context
            ));
        } catch (NoActiveProjectException e) {
            return conflict(e);
        }
    }

    private static ResponseEntity<Map<String, String>> conflict(NoActiveProjectException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }
}
