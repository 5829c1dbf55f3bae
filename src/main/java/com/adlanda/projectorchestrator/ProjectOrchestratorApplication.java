package com.adlanda.projectorchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AI Project Orchestrator - Main Application
 *
 * Hosts several independent codebases side by side and switches the active
 * one at runtime: its vector index, its fine-tuned adapter and its
 * conversation context are swapped together, without a restart.
 *
 * This application uses:
 * - Spring Boot 3.4 with Java 17
 * - Spring AI for embedding generation via OpenAI and per-project SimpleVectorStore indexes
 * - Spring Data JPA over H2 for the project registry
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class ProjectOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProjectOrchestratorApplication.class, args);
    }
}
