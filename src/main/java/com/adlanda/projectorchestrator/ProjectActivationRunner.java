package com.adlanda.projectorchestrator;

import com.adlanda.projectorchestrator.config.WorkspaceProperties;
import com.adlanda.projectorchestrator.model.SwitchResult;
import com.adlanda.projectorchestrator.service.ProjectSwitchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Activates the configured startup project, if any.
 *
 * A failed activation is logged and the application keeps running with no
 * active project; projects can still be switched through the API.
 */
@Component
@Order(1) // Run before StartupInfoLogger
public class ProjectActivationRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ProjectActivationRunner.class);

    private final ProjectSwitchService switchService;
    private final WorkspaceProperties properties;

    public ProjectActivationRunner(ProjectSwitchService switchService, WorkspaceProperties properties) {
        this.switchService = switchService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        String projectId = properties.getSwitching().getStartupProject();
        if (projectId == null || projectId.isBlank()) {
            log.info("No startup project configured");
            return;
        }

        log.info("Activating startup project {}...", projectId);
        SwitchResult result = switchService.switchProject(projectId);
        if (!result.success()) {
            log.error("Failed to activate startup project {}: {}", projectId, result.message());
        } else if (result.degraded()) {
            log.warn("Startup project {} active, degraded: {}", projectId, result.degradedManagers());
        } else {
            log.info("Startup project {} active", projectId);
        }
    }
}
