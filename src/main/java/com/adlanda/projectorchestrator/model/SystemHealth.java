package com.adlanda.projectorchestrator.model;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate health of the switch orchestrator and its collaborators.
 *
 * @param status            UP when everything is loaded (or nothing is active yet),
 *                          DEGRADED when a manager is in ERROR, DOWN when the registry is unreachable
 * @param currentProjectId  Active project id, or null
 * @param managers          Status per resource manager
 * @param managerMessages   Last failure message per degraded manager
 * @param registryReachable Whether the registry store answered
 * @param projectCount      Registered projects, -1 when the registry is unreachable
 * @param checkedAt         Time of the check
 */
public record SystemHealth(
        Status status,
        String currentProjectId,
        Map<String, ManagerStatus> managers,
        Map<String, String> managerMessages,
        boolean registryReachable,
        long projectCount,
        Instant checkedAt
) {
    public enum Status { UP, DEGRADED, DOWN }
}
