package com.adlanda.projectorchestrator.controller;

import com.adlanda.projectorchestrator.exception.NoActiveProjectException;
import com.adlanda.projectorchestrator.exception.ProjectMismatchException;
import com.adlanda.projectorchestrator.model.QueryRequest;
import com.adlanda.projectorchestrator.model.QueryResponse;
import com.adlanda.projectorchestrator.service.ProjectSwitchService;
import com.adlanda.projectorchestrator.service.RetrievalService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for querying the active project's index.
 */
@RestController
@RequestMapping("/api/v1")
public class QueryController {

    private final RetrievalService retrievalService;
    private final ProjectSwitchService switchService;

    public QueryController(RetrievalService retrievalService, ProjectSwitchService switchService) {
        this.retrievalService = retrievalService;
        this.switchService = switchService;
    }

    /**
     * Query for relevant context based on a question.
     *
     * @param request The query request containing the question
     * @return QueryResponse with matched chunks, or 409 when no project is active
     */
    @PostMapping("/query")
    public ResponseEntity<?> query(@Valid @RequestBody QueryRequest request) {
        try {
            QueryResponse response = retrievalService.query(request.question(), request.maxResults());
            return ResponseEntity.ok(response);
        } catch (NoActiveProjectException | ProjectMismatchException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Get index statistics of the active project.
     */
    @GetMapping("/sources")
    public ResponseEntity<Map<String, Object>> getSources() {
        int size = retrievalService.getIndexSize();
        return ResponseEntity.ok(Map.of(
                "projectId", switchService.currentProject().orElse("none"),
                "totalChunks", size,
                "status", size > 0 ? "indexed" : "empty"
        ));
    }
}
