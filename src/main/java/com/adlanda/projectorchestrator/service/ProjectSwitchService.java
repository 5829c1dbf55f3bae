package com.adlanda.projectorchestrator.service;

import com.adlanda.projectorchestrator.config.WorkspaceProperties;
import com.adlanda.projectorchestrator.exception.ProjectRegistryException;
import com.adlanda.projectorchestrator.manager.AdapterLoaderManager;
import com.adlanda.projectorchestrator.manager.ConversationContextManager;
import com.adlanda.projectorchestrator.manager.ProjectResourceManager;
import com.adlanda.projectorchestrator.manager.VectorStoreManager;
import com.adlanda.projectorchestrator.model.ActiveProjectSnapshot;
import com.adlanda.projectorchestrator.model.ManagerStatus;
import com.adlanda.projectorchestrator.model.ProjectRecord;
import com.adlanda.projectorchestrator.model.SwitchResult;
import com.adlanda.projectorchestrator.model.SystemHealth;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Switches the whole process from one project to another.
 *
 * A switch validates the target against the registry and then moves every
 * resource manager over, in a fixed order. It is best effort: once the
 * project is known it becomes the active one even if some managers fail, and
 * the result says which ones are degraded. Managers that did switch are not
 * rolled back. Asking again for the active project retries only the managers
 * that are not loaded.
 */
@Service
public class ProjectSwitchService {

    private static final Logger log = LoggerFactory.getLogger(ProjectSwitchService.class);

    private final ProjectRegistryService registry;
    private final List<ProjectResourceManager> managers;
    private final ActiveProjectState state;
    private final Duration lockTimeout;
    private final ReentrantLock switchLock = new ReentrantLock();

    @Autowired
    public ProjectSwitchService(ProjectRegistryService registry,
                                VectorStoreManager vectorStoreManager,
                                AdapterLoaderManager adapterLoaderManager,
                                ConversationContextManager contextManager,
                                ActiveProjectState state,
                                WorkspaceProperties properties) {
        this(registry,
                List.of(vectorStoreManager, adapterLoaderManager, contextManager),
                state,
                properties.getSwitching().getLockTimeout());
    }

    ProjectSwitchService(ProjectRegistryService registry,
                         List<ProjectResourceManager> managers,
                         ActiveProjectState state,
                         Duration lockTimeout) {
        this.registry = registry;
        this.managers = List.copyOf(managers);
        this.state = state;
        this.lockTimeout = lockTimeout;
        state.publish(ActiveProjectSnapshot.empty(managerNames()));
    }

    /**
     * Makes {@code projectId} the active project.
     *
     * @return a refused result when the id is unknown, the registry cannot be
     *         read or another switch holds the gate for too long; otherwise a
     *         successful result, possibly degraded
     */
    public SwitchResult switchProject(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            return SwitchResult.refused(projectId, "Project id must not be blank");
        }
        if (!acquireGate()) {
            log.warn("Switch to {} refused: another switch is still running after {} ms",
                    projectId, lockTimeout.toMillis());
            return SwitchResult.refused(projectId, "Another project switch is in progress");
        }
        try {
            Optional<ProjectRecord> project;
            try {
                project = registry.get(projectId);
            } catch (DataAccessException e) {
                log.error("Switch to {} refused: project registry unreachable", projectId, e);
                return SwitchResult.refused(projectId, "Project registry is unreachable");
            }
            if (project.isEmpty()) {
                log.warn("Switch refused: project {} does not exist", projectId);
                return SwitchResult.refused(projectId, "Project not found: " + projectId);
            }
            return doSwitch(project.get());
        } finally {
            switchLock.unlock();
        }
    }

    public Optional<String> currentProject() {
        return state.snapshot().currentProject();
    }

    public ActiveProjectSnapshot activeSnapshot() {
        return state.snapshot();
    }

    public SystemHealth health() {
        ActiveProjectSnapshot snapshot = state.snapshot();
        boolean reachable = registry.isReachable();
        long projectCount = -1;
        if (reachable) {
            try {
                projectCount = registry.count();
            } catch (DataAccessException e) {
                reachable = false;
            }
        }

        SystemHealth.Status status;
        if (!reachable) {
            status = SystemHealth.Status.DOWN;
        } else if (snapshot.isDegraded()) {
            status = SystemHealth.Status.DEGRADED;
        } else {
            status = SystemHealth.Status.UP;
        }
        return new SystemHealth(
                status,
                snapshot.currentProjectId(),
                snapshot.managerStatuses(),
                snapshot.managerMessages(),
                reachable,
                projectCount,
                Instant.now()
        );
    }

    /**
     * Deletes a project from the registry along with its stored index, adapter
     * and conversation. Artifact cleanup failures are logged; the registry row
     * is removed regardless.
     *
     * @throws ProjectRegistryException if the project is active or a switch is running
     */
    public void removeProject(String projectId) {
        if (!acquireGate()) {
            throw new ProjectRegistryException("Another project switch is in progress");
        }
        try {
            if (projectId != null && projectId.equals(state.snapshot().currentProjectId())) {
                throw new ProjectRegistryException("Cannot remove the active project " + projectId);
            }
            registry.require(projectId);
            for (ProjectResourceManager manager : managers) {
                try {
                    manager.deleteArtifacts(projectId);
                } catch (IOException | RuntimeException e) {
                    log.warn("{} could not delete artifacts of project {}: {}", manager.name(), projectId, e.getMessage());
                }
            }
            registry.remove(projectId);
            log.info("Removed project {}", projectId);
        } finally {
            switchLock.unlock();
        }
    }

    /**
     * Releases every manager and clears the active project.
     */
    @PreDestroy
    public void unloadAll() {
        if (!acquireGate()) {
            log.warn("Unload skipped: a project switch is still running");
            return;
        }
        try {
            for (ProjectResourceManager manager : managers) {
                try {
                    manager.unload();
                } catch (RuntimeException e) {
                    log.error("Failed to unload {}", manager.name(), e);
                }
            }
            state.publish(ActiveProjectSnapshot.empty(managerNames()));
            log.info("All project resources unloaded");
        } finally {
            switchLock.unlock();
        }
    }

    private SwitchResult doSwitch(ProjectRecord project) {
        String projectId = project.id();
        ActiveProjectSnapshot previous = state.snapshot();
        boolean alreadyActive = projectId.equals(previous.currentProjectId());

        Map<String, ManagerStatus> statuses = new LinkedHashMap<>();
        Map<String, String> messages = new LinkedHashMap<>();
        int attempted = 0;

        for (ProjectResourceManager manager : managers) {
            String name = manager.name();
            if (alreadyActive && previous.statusOf(name) == ManagerStatus.LOADED
                    && manager.current().filter(projectId::equals).isPresent()) {
                statuses.put(name, ManagerStatus.LOADED);
                continue;
            }
            attempted++;
            try {
                if (manager.switchProject(projectId)) {
                    statuses.put(name, ManagerStatus.LOADED);
                } else {
                    statuses.put(name, ManagerStatus.ERROR);
                    messages.put(name, name + " could not load project " + projectId);
                }
            } catch (RuntimeException e) {
                log.error("{} failed while switching to project {}", name, projectId, e);
                statuses.put(name, ManagerStatus.ERROR);
                messages.put(name, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        Instant switchedAt = alreadyActive && attempted == 0 ? previous.switchedAt() : Instant.now();
        ActiveProjectSnapshot snapshot = new ActiveProjectSnapshot(projectId, statuses, messages, switchedAt);
        state.publish(snapshot);

        String message;
        if (alreadyActive && attempted == 0) {
            message = "Project " + project.name() + " is already active";
        } else if (snapshot.isDegraded()) {
            message = "Switched to project " + project.name() + " with degraded " + snapshot.degradedManagers();
            log.warn("Switched to project {} ({}) degraded: {}", projectId, project.name(), snapshot.degradedManagers());
        } else {
            message = "Switched to project " + project.name();
            log.info("Switched to project {} ({})", projectId, project.name());
        }
        return SwitchResult.of(projectId, message, snapshot);
    }

    private boolean acquireGate() {
        try {
            return switchLock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private List<String> managerNames() {
        return managers.stream().map(ProjectResourceManager::name).toList();
    }
}
