package com.adlanda.projectorchestrator.health;

import com.adlanda.projectorchestrator.model.SystemHealth;
import com.adlanda.projectorchestrator.service.ProjectSwitchService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Health indicator for project switching, reported as component {@code projectSwitch}.
 *
 * Reports:
 * - The active project, if any
 * - The status of each resource manager and the last failure of degraded ones
 * - Whether the project registry answers, and how many projects it holds
 *
 * A degraded switch is reported as the custom status DEGRADED, which
 * Actuator's default ordering treats like UNKNOWN: the aggregate stays UP.
 */
@Component
public class ProjectSwitchHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "Some resource managers failed to load the active project");

    private final ProjectSwitchService switchService;

    public ProjectSwitchHealthIndicator(ProjectSwitchService switchService) {
        this.switchService = switchService;
    }

    @Override
    public Health health() {
        SystemHealth health = switchService.health();

        Health.Builder builder;
        if (health.status() == SystemHealth.Status.DOWN) {
            builder = Health.down();
        } else if (health.status() == SystemHealth.Status.DEGRADED) {
            builder = Health.status(DEGRADED);
        } else {
            builder = Health.up();
        }

        builder.withDetail("currentProject", health.currentProjectId() != null ? health.currentProjectId() : "none")
               .withDetail("managers", health.managers())
               .withDetail("registryReachable", health.registryReachable())
               .withDetail("projectCount", health.projectCount());
        if (!health.managerMessages().isEmpty()) {
            builder.withDetail("errors", health.managerMessages());
        }
        return builder.build();
    }
}
