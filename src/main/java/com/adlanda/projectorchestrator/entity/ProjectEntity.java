package com.adlanda.projectorchestrator.entity;

import com.adlanda.projectorchestrator.model.TrainingStatus;
import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * JPA entity for a registered project.
 *
 * The id is assigned once at registration and never changes. The training
 * status is written by the external training pipeline through the registry.
 */
@Entity
@Table(name = "projects")
public class ProjectEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "source_path", nullable = false, length = 1000)
    private String sourcePath;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "training_status", nullable = false, length = 20)
    private TrainingStatus trainingStatus;

    @Column(name = "file_count")
    private Integer fileCount;

    @Version
    @Column(name = "version")
    private Long version;

    // Default constructor for JPA
    protected ProjectEntity() {
    }

    public ProjectEntity(String name, String sourcePath) {
        this.id = UUID.randomUUID().toString();
        this.name = name;
        this.sourcePath = sourcePath;
        this.trainingStatus = TrainingStatus.PENDING;
        this.fileCount = 0;
    }

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public void setSourcePath(String sourcePath) {
        this.sourcePath = sourcePath;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public TrainingStatus getTrainingStatus() {
        return trainingStatus;
    }

    public void setTrainingStatus(TrainingStatus trainingStatus) {
        this.trainingStatus = trainingStatus;
    }

    public Integer getFileCount() {
        return fileCount;
    }

    public void setFileCount(Integer fileCount) {
        this.fileCount = fileCount;
    }

    public Long getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "ProjectEntity{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", sourcePath='" + sourcePath + '\'' +
                ", trainingStatus=" + trainingStatus +
                ", fileCount=" + fileCount +
                '}';
    }
}
