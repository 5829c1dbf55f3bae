package com.adlanda.projectorchestrator.service;

import com.adlanda.projectorchestrator.exception.NoActiveProjectException;
import com.adlanda.projectorchestrator.manager.VectorStoreManager;
import com.adlanda.projectorchestrator.model.QueryResponse;
import com.adlanda.projectorchestrator.model.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service responsible for retrieving relevant context from the active project.
 *
 * Orchestrates the query flow:
 * 1. Resolve the active project
 * 2. Search its vector index (the query embedding goes through the cache)
 * 3. Return ranked results
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final ProjectSwitchService switchService;
    private final VectorStoreManager vectorStoreManager;

    public RetrievalService(ProjectSwitchService switchService, VectorStoreManager vectorStoreManager) {
        this.switchService = switchService;
        this.vectorStoreManager = vectorStoreManager;
    }

    /**
     * Queries the active project's vector store for relevant context.
     *
     * @param question   The question to search for
     * @param maxResults Maximum number of results to return
     * @return QueryResponse containing the matched chunks and metadata
     * @throws NoActiveProjectException if no project is active or its index is not loaded
     */
    public QueryResponse query(String question, int maxResults) {
        long startTime = System.currentTimeMillis();
        String projectId = activeProjectWithIndex();

        List<Document> documents = vectorStoreManager.search(projectId, question, maxResults);
        List<QueryResult> results = documents.stream()
                .map(QueryResult::from)
                .toList();

        long queryTimeMs = System.currentTimeMillis() - startTime;

        log.debug("Query '{}' on project {} returned {} results in {}ms",
                truncate(question, 50), projectId, results.size(), queryTimeMs);

        return new QueryResponse(projectId, results, vectorStoreManager.size(), queryTimeMs);
    }

    /**
     * Returns the number of chunks in the active project's index (0 when nothing is loaded).
     */
    public int getIndexSize() {
        return vectorStoreManager.size();
    }

    private String activeProjectWithIndex() {
        String projectId = switchService.currentProject()
                .orElseThrow(() -> new NoActiveProjectException("No project is active"));
        if (!projectId.equals(vectorStoreManager.current().orElse(null))) {
            throw new NoActiveProjectException("Vector store of project " + projectId + " is not loaded");
        }
        return projectId;
    }

    private String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
