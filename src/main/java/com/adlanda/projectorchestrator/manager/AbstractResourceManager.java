package com.adlanda.projectorchestrator.manager;

import com.adlanda.projectorchestrator.exception.ProjectMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Switch bookkeeping shared by the resource managers.
 *
 * Switching and unloading hold the write lock; subclasses take the read lock
 * for queries and the write lock for mutations, so no call observes a
 * half-switched manager.
 */
public abstract class AbstractResourceManager implements ProjectResourceManager {

    private static final Pattern PROJECT_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private String currentProjectId;

    @Override
    public boolean switchProject(String projectId) {
        requireValidId(projectId);
        lock.writeLock().lock();
        try {
            if (projectId.equals(currentProjectId)) {
                log.debug("{}: project {} already loaded", name(), projectId);
                return true;
            }
            releaseCurrent();

            if (activate(projectId)) {
                currentProjectId = projectId;
                log.info("{}: loaded project {}", name(), projectId);
                return true;
            }
            log.warn("{}: could not load project {}", name(), projectId);
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<String> current() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(currentProjectId);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void unload() {
        lock.writeLock().lock();
        try {
            releaseCurrent();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void deleteArtifacts(String projectId) throws IOException {
        requireValidId(projectId);
        lock.writeLock().lock();
        try {
            if (projectId.equals(currentProjectId)) {
                throw new IllegalStateException(name() + ": project " + projectId + " is loaded");
            }
            Path artifact = artifactPath(projectId);
            if (Files.notExists(artifact, LinkOption.NOFOLLOW_LINKS)) {
                return;
            }
            if (Files.isDirectory(artifact, LinkOption.NOFOLLOW_LINKS)) {
                try (Stream<Path> paths = Files.walk(artifact)) {
                    for (Path p : paths.sorted(Comparator.reverseOrder()).toList()) {
                        Files.deleteIfExists(p);
                    }
                }
            } else {
                Files.deleteIfExists(artifact);
            }
            log.info("{}: deleted artifacts of project {}", name(), projectId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Location of a project's stored artifact: a file or a directory.
     */
    protected abstract Path artifactPath(String projectId);

    /**
     * Loads the resources of a project. Called with the write lock held and no project loaded.
     *
     * @return false when the project's artifacts are missing or unusable
     */
    protected abstract boolean activate(String projectId);

    /**
     * Persists and drops the resources of the loaded project. Called with the write lock held.
     */
    protected abstract void release(String projectId) throws IOException;

    /**
     * Current project id; callers must hold the lock.
     */
    protected String currentProjectId() {
        return currentProjectId;
    }

    /**
     * Fails unless {@code projectId} is the loaded project. Callers must hold the lock.
     */
    protected void requireCurrent(String projectId) {
        if (currentProjectId == null || !currentProjectId.equals(projectId)) {
            throw new ProjectMismatchException(name(), projectId, currentProjectId);
        }
    }

    protected static void requireValidId(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("Project id must not be blank");
        }
        if (!PROJECT_ID.matcher(projectId).matches() || projectId.contains("..")) {
            throw new IllegalArgumentException("Invalid project id: " + projectId);
        }
    }

    /**
     * Renames a fully written temporary file over its target.
     */
    protected static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void releaseCurrent() {
        if (currentProjectId == null) {
            return;
        }
        String previous = currentProjectId;
        currentProjectId = null;
        try {
            release(previous);
            log.info("{}: released project {}", name(), previous);
        } catch (IOException e) {
            log.error("{}: failed to persist project {} on release", name(), previous, e);
        }
    }
}
