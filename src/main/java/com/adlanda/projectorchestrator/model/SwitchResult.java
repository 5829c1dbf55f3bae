package com.adlanda.projectorchestrator.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a project switch.
 *
 * A switch to a known project always reports {@code success = true}, even when
 * some resource managers failed. In that case {@code degraded} is set and
 * {@code degradedManagers} lists the managers left in ERROR, so the caller can
 * keep working with the new project while seeing what is not available.
 *
 * @param success          False only when the switch was refused (unknown id, registry down, busy)
 * @param projectId        Requested project id
 * @param message          Human-readable summary
 * @param degraded         True when at least one manager is in ERROR after the switch
 * @param managerStatuses  Status of each manager after the switch
 * @param degradedManagers Names of the managers in ERROR
 */
public record SwitchResult(
        boolean success,
        String projectId,
        String message,
        boolean degraded,
        Map<String, ManagerStatus> managerStatuses,
        List<String> degradedManagers
) {
    public static SwitchResult refused(String projectId, String message) {
        return new SwitchResult(false, projectId, message, false, Map.of(), List.of());
    }

    public static SwitchResult of(String projectId, String message, ActiveProjectSnapshot snapshot) {
        return new SwitchResult(
                true,
                projectId,
                message,
                snapshot.isDegraded(),
                snapshot.managerStatuses(),
                snapshot.degradedManagers()
        );
    }
}
