package com.adlanda.projectorchestrator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the process-wide active project state.
 *
 * @param currentProjectId Active project id, or null when nothing is active
 * @param managerStatuses  Status of each resource manager, in switch order
 * @param managerMessages  Last failure message per manager (only for managers in ERROR)
 * @param switchedAt       When the snapshot was published, or null before the first switch
 */
public record ActiveProjectSnapshot(
        String currentProjectId,
        Map<String, ManagerStatus> managerStatuses,
        Map<String, String> managerMessages,
        Instant switchedAt
) {
    public ActiveProjectSnapshot {
        managerStatuses = Collections.unmodifiableMap(new LinkedHashMap<>(managerStatuses));
        managerMessages = Collections.unmodifiableMap(new LinkedHashMap<>(managerMessages));
    }

    /**
     * Snapshot with no active project and every manager unloaded.
     */
    public static ActiveProjectSnapshot empty(List<String> managerNames) {
        Map<String, ManagerStatus> statuses = new LinkedHashMap<>();
        managerNames.forEach(name -> statuses.put(name, ManagerStatus.UNLOADED));
        return new ActiveProjectSnapshot(null, statuses, Map.of(), null);
    }

    public Optional<String> currentProject() {
        return Optional.ofNullable(currentProjectId);
    }

    public ManagerStatus statusOf(String managerName) {
        return managerStatuses.getOrDefault(managerName, ManagerStatus.UNLOADED);
    }

    public List<String> degradedManagers() {
        return managerStatuses.entrySet().stream()
                .filter(e -> e.getValue() == ManagerStatus.ERROR)
                .map(Map.Entry::getKey)
                .toList();
    }

    public boolean isDegraded() {
        return !degradedManagers().isEmpty();
    }
}
