package com.adlanda.projectorchestrator.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api/v1")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("projects", "GET|POST /api/v1/projects - List or register projects");
        endpoints.put("project", "GET|DELETE /api/v1/projects/{id} - Show or remove a project");
        endpoints.put("status", "PUT /api/v1/projects/{id}/status - Update training status");
        endpoints.put("switch", "POST /api/v1/projects/{id}/switch - Make a project active");
        endpoints.put("current", "GET /api/v1/projects/current - Active project and manager status");
        endpoints.put("files", "GET /api/v1/projects/{id}/files - Preview discovered files");
        endpoints.put("index", "POST /api/v1/projects/{id}/index - Index the active project");
        endpoints.put("query", "POST /api/v1/query - Query the active project's index");
        endpoints.put("sources", "GET /api/v1/sources - Index statistics");
        endpoints.put("context", "GET|POST|DELETE /api/v1/context/messages - Conversation context");
        endpoints.put("recent", "GET /api/v1/context/recent - Recent conversation as model input");
        endpoints.put("cache", "GET|DELETE /api/v1/cache - Embedding cache statistics");
        endpoints.put("health", "GET /actuator/health - Health check");

        return ResponseEntity.ok(Map.of(
                "service", "AI Project Orchestrator",
                "version", appVersion,
                "endpoints", endpoints
        ));
    }
}
