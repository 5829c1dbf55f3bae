package com.adlanda.projectorchestrator.service;

import com.adlanda.projectorchestrator.entity.ProjectEntity;
import com.adlanda.projectorchestrator.exception.InvalidTransitionException;
import com.adlanda.projectorchestrator.exception.ProjectNotFoundException;
import com.adlanda.projectorchestrator.exception.ProjectRegistryException;
import com.adlanda.projectorchestrator.model.ProjectRecord;
import com.adlanda.projectorchestrator.model.TrainingStatus;
import com.adlanda.projectorchestrator.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Durable registry of projects.
 *
 * Every read goes to the repository, so status changes written by another
 * process (the training pipeline) are visible on the next call.
 */
@Service
public class ProjectRegistryService {

    private static final Logger log = LoggerFactory.getLogger(ProjectRegistryService.class);

    private static final String INVALID_NAME_CHARS = "<>:\"/\\|?*";
    private static final int MAX_NAME_LENGTH = 200;

    private final ProjectRepository repository;

    public ProjectRegistryService(ProjectRepository repository) {
        this.repository = repository;
    }

    /**
     * Registers a new project in {@link TrainingStatus#PENDING}.
     *
     * @param name       Display name; not unique
     * @param sourcePath Existing directory holding the project's sources
     * @return the stored record with its new id
     * @throws ProjectRegistryException if the name or path is invalid
     */
    public ProjectRecord register(String name, String sourcePath) {
        validateName(name);
        Path source = validateSourcePath(sourcePath);

        ProjectEntity entity = new ProjectEntity(name.trim(), source.toAbsolutePath().normalize().toString());
        ProjectEntity saved = repository.save(entity);
        log.info("Registered project {} '{}' at {}", saved.getId(), saved.getName(), saved.getSourcePath());
        return ProjectRecord.from(saved);
    }

    public Optional<ProjectRecord> get(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return repository.findById(id).map(ProjectRecord::from);
    }

    /**
     * Like {@link #get(String)} but fails for unknown ids.
     */
    public ProjectRecord require(String id) {
        return get(id).orElseThrow(() -> new ProjectNotFoundException(id));
    }

    public List<ProjectRecord> list() {
        return repository.findAllByOrderByCreatedAtAsc().stream()
                .map(ProjectRecord::from)
                .toList();
    }

    /**
     * Moves a project's training status forward.
     *
     * @throws ProjectNotFoundException   if the id is unknown
     * @throws InvalidTransitionException if the change would move backwards or leave a terminal state
     */
    public ProjectRecord updateStatus(String id, TrainingStatus status) {
        ProjectEntity entity = repository.findById(id)
                .orElseThrow(() -> new ProjectNotFoundException(id));
        TrainingStatus current = entity.getTrainingStatus();

        if (!current.canTransitionTo(status)) {
            throw new InvalidTransitionException(id, current, status);
        }
        if (current == status) {
            return ProjectRecord.from(entity);
        }

        entity.setTrainingStatus(status);
        ProjectEntity saved = repository.save(entity);
        log.info("Project {} training status {} -> {}", id, current, status);
        return ProjectRecord.from(saved);
    }

    /**
     * Records how many source files the last ingestion of a project indexed.
     */
    public ProjectRecord updateFileCount(String id, int fileCount) {
        ProjectEntity entity = repository.findById(id)
                .orElseThrow(() -> new ProjectNotFoundException(id));
        entity.setFileCount(fileCount);
        return ProjectRecord.from(repository.save(entity));
    }

    /**
     * Deletes a project row. Callers are responsible for not removing the active project.
     */
    public void remove(String id) {
        if (!repository.existsById(id)) {
            throw new ProjectNotFoundException(id);
        }
        repository.deleteById(id);
        log.info("Removed project {}", id);
    }

    public long count() {
        return repository.count();
    }

    /**
     * Returns false when the backing database cannot be queried.
     */
    public boolean isReachable() {
        try {
            repository.count();
            return true;
        } catch (DataAccessException e) {
            log.warn("Project registry unreachable: {}", e.getMessage());
            return false;
        }
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new ProjectRegistryException("Project name must not be blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ProjectRegistryException("Project name is longer than " + MAX_NAME_LENGTH + " characters");
        }
        for (char c : name.toCharArray()) {
            if (INVALID_NAME_CHARS.indexOf(c) >= 0) {
                throw new ProjectRegistryException("Project name contains invalid character '" + c + "'");
            }
        }
    }

    private static Path validateSourcePath(String sourcePath) {
        if (sourcePath == null || sourcePath.isBlank()) {
            throw new ProjectRegistryException("Source path must not be blank");
        }
        Path path;
        try {
            path = Path.of(sourcePath);
        } catch (InvalidPathException e) {
            throw new ProjectRegistryException("Invalid source path: " + sourcePath);
        }
        if (!Files.isDirectory(path)) {
            throw new ProjectRegistryException("Source path is not an existing directory: " + sourcePath);
        }
        return path;
    }
}
