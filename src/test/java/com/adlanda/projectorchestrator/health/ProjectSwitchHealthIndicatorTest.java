package com.adlanda.projectorchestrator.health;

import com.adlanda.projectorchestrator.model.ManagerStatus;
import com.adlanda.projectorchestrator.model.SystemHealth;
import com.adlanda.projectorchestrator.service.ProjectSwitchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProjectSwitchHealthIndicatorTest {

    @Mock
    private ProjectSwitchService switchService;

    private ProjectSwitchHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        indicator = new ProjectSwitchHealthIndicator(switchService);
    }

    @Test
    void health_noActiveProject_isUp() {
        when(switchService.health()).thenReturn(health(SystemHealth.Status.UP, null, ManagerStatus.UNLOADED, Map.of(), true, 0));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("currentProject", "none")
                .containsEntry("registryReachable", true)
                .containsEntry("projectCount", 0L)
                .doesNotContainKey("errors");
    }

    @Test
    void health_degradedSwitch_reportsDegradedWithErrors() {
        when(switchService.health()).thenReturn(health(SystemHealth.Status.DEGRADED, "p1", ManagerStatus.ERROR,
                Map.of("model-loader", "Adapter not found"), true, 2));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(ProjectSwitchHealthIndicator.DEGRADED);
        assertThat(health.getDetails())
                .containsEntry("currentProject", "p1")
                .containsEntry("errors", Map.of("model-loader", "Adapter not found"));
    }

    @Test
    void health_registryUnreachable_isDown() {
        when(switchService.health()).thenReturn(health(SystemHealth.Status.DOWN, null, ManagerStatus.UNLOADED, Map.of(), false, -1));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails())
                .containsEntry("registryReachable", false)
                .containsEntry("projectCount", -1L);
    }

    private static SystemHealth health(SystemHealth.Status status, String projectId, ManagerStatus managerStatus,
                                       Map<String, String> messages, boolean reachable, long count) {
        return new SystemHealth(status, projectId, Map.of("vector-store", managerStatus), messages,
                reachable, count, Instant.now());
    }
}
