package com.adlanda.projectorchestrator.repository;

import com.adlanda.projectorchestrator.entity.ProjectEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Durable store of the project registry.
 */
@Repository
public interface ProjectRepository extends JpaRepository<ProjectEntity, String> {

    /**
     * All projects, oldest registration first.
     */
    List<ProjectEntity> findAllByOrderByCreatedAtAsc();
}
