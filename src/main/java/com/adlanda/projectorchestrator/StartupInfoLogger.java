package com.adlanda.projectorchestrator;

import com.adlanda.projectorchestrator.service.ProjectRegistryService;
import com.adlanda.projectorchestrator.service.ProjectSwitchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2) // Run after ProjectActivationRunner
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final ProjectRegistryService registry;
    private final ProjectSwitchService switchService;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(ProjectRegistryService registry, ProjectSwitchService switchService) {
        this.registry = registry;
        this.switchService = switchService;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            AI Project Orchestrator v{}
            Projects: {}, active: {}

            API Endpoints:
              GET  http://localhost:{}/api/v1
              GET  http://localhost:{}/api/v1/projects
              POST http://localhost:{}/api/v1/projects/{id}/switch
              POST http://localhost:{}/api/v1/query

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, registry.count(), switchService.currentProject().orElse("none"),
            port, port, port, port, port
        );
    }
}
