package com.adlanda.projectorchestrator.model;

import com.adlanda.projectorchestrator.entity.ProjectEntity;

import java.time.LocalDateTime;

/**
 * Read-only view of a registered project.
 *
 * @param id             Unique, immutable project identifier (UUID string)
 * @param name           Human-readable name
 * @param sourcePath     Root of the project's source tree
 * @param createdAt      Registration time
 * @param updatedAt      Last modification of the registry row
 * @param trainingStatus Adapter training status
 * @param fileCount      Source files indexed by the last ingestion run
 */
public record ProjectRecord(
        String id,
        String name,
        String sourcePath,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        TrainingStatus trainingStatus,
        int fileCount
) {
    public static ProjectRecord from(ProjectEntity entity) {
        return new ProjectRecord(
                entity.getId(),
                entity.getName(),
                entity.getSourcePath(),
                entity.getCreatedAt(),
                entity.getUpdatedAt(),
                entity.getTrainingStatus(),
                entity.getFileCount() != null ? entity.getFileCount() : 0
        );
    }
}
