package com.adlanda.projectorchestrator.manager;

import java.io.IOException;
import java.util.Optional;

/**
 * A holder of one project's worth of a resource (vector index, adapter, conversation).
 *
 * At most one project is loaded at a time. Switching to the project that is
 * already loaded returns true without reloading. A failed switch returns
 * false and leaves the manager with no project loaded.
 */
public interface ProjectResourceManager {

    /**
     * Stable name used in switch results and health reports.
     */
    String name();

    /**
     * Releases the current project, if any, and loads {@code projectId}.
     *
     * @return true if the project is loaded afterwards
     * @throws IllegalArgumentException if the id is null, blank or not a valid file name
     */
    boolean switchProject(String projectId);

    Optional<String> current();

    /**
     * Releases the current project, persisting what needs persisting.
     */
    void unload();

    /**
     * Deletes the stored artifacts of a project that is not loaded.
     *
     * @throws IllegalStateException if {@code projectId} is the loaded project
     * @throws IOException           if an artifact could not be deleted
     */
    void deleteArtifacts(String projectId) throws IOException;
}
