package com.adlanda.projectorchestrator.service;

import com.adlanda.projectorchestrator.entity.ProjectEntity;
import com.adlanda.projectorchestrator.exception.InvalidTransitionException;
import com.adlanda.projectorchestrator.exception.ProjectNotFoundException;
import com.adlanda.projectorchestrator.exception.ProjectRegistryException;
import com.adlanda.projectorchestrator.model.ProjectRecord;
import com.adlanda.projectorchestrator.model.TrainingStatus;
import com.adlanda.projectorchestrator.repository.ProjectRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ProjectRegistryService.
 * Tests validation, status transitions and repository interaction.
 */
@ExtendWith(MockitoExtension.class)
class ProjectRegistryServiceTest {

    @Mock
    private ProjectRepository repository;

    @TempDir
    Path sourceDir;

    private ProjectRegistryService registry;

    @BeforeEach
    void setUp() {
        registry = new ProjectRegistryService(repository);
    }

    @Test
    void register_validProject_savesPendingRecordWithFreshId() {
        when(repository.save(any(ProjectEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        ProjectRecord record = registry.register("alpha", sourceDir.toString());

        assertThat(record.id()).isNotBlank();
        assertThat(record.name()).isEqualTo("alpha");
        assertThat(record.trainingStatus()).isEqualTo(TrainingStatus.PENDING);
        assertThat(record.sourcePath()).isEqualTo(sourceDir.toAbsolutePath().normalize().toString());
        assertThat(record.fileCount()).isZero();
    }

    @Test
    void register_sameSourceTwice_createsTwoProjects() {
        when(repository.save(any(ProjectEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        ProjectRecord first = registry.register("alpha", sourceDir.toString());
        ProjectRecord second = registry.register("alpha", sourceDir.toString());

        assertThat(first.id()).isNotEqualTo(second.id());
        verify(repository, times(2)).save(any(ProjectEntity.class));
    }

    @Test
    void register_blankName_isRejected() {
        assertThatThrownBy(() -> registry.register("  ", sourceDir.toString()))
                .isInstanceOf(ProjectRegistryException.class);
        verifyNoInteractions(repository);
    }

    @Test
    void register_nameWithPathCharacters_isRejected() {
        assertThatThrownBy(() -> registry.register("../evil", sourceDir.toString()))
                .isInstanceOf(ProjectRegistryException.class)
                .hasMessageContaining("invalid character");
    }

    @Test
    void register_missingSourcePath_isRejected() {
        assertThatThrownBy(() -> registry.register("alpha", sourceDir.resolve("missing").toString()))
                .isInstanceOf(ProjectRegistryException.class)
                .hasMessageContaining("not an existing directory");
        verify(repository, never()).save(any());
    }

    @Test
    void get_unknownId_returnsEmpty() {
        when(repository.findById("nope")).thenReturn(Optional.empty());

        assertThat(registry.get("nope")).isEmpty();
    }

    @Test
    void get_blankId_doesNotQueryRepository() {
        assertThat(registry.get("")).isEmpty();
        verifyNoInteractions(repository);
    }

    @Test
    void list_queriesRepositoryEveryTime() {
        ProjectEntity entity = new ProjectEntity("alpha", sourceDir.toString());
        when(repository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of(entity));

        registry.list();
        List<ProjectRecord> projects = registry.list();

        assertThat(projects).extracting(ProjectRecord::name).containsExactly("alpha");
        verify(repository, times(2)).findAllByOrderByCreatedAtAsc();
    }

    @Test
    void updateStatus_forwardTransition_isSaved() {
        ProjectEntity entity = new ProjectEntity("alpha", sourceDir.toString());
        when(repository.findById(entity.getId())).thenReturn(Optional.of(entity));
        when(repository.save(entity)).thenReturn(entity);

        ProjectRecord updated = registry.updateStatus(entity.getId(), TrainingStatus.TRAINING);

        assertThat(updated.trainingStatus()).isEqualTo(TrainingStatus.TRAINING);
        ArgumentCaptor<ProjectEntity> saved = ArgumentCaptor.forClass(ProjectEntity.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getTrainingStatus()).isEqualTo(TrainingStatus.TRAINING);
    }

    @Test
    void updateStatus_backwardTransition_throwsAndLeavesStateUntouched() {
        ProjectEntity entity = new ProjectEntity("alpha", sourceDir.toString());
        entity.setTrainingStatus(TrainingStatus.COMPLETED);
        when(repository.findById(entity.getId())).thenReturn(Optional.of(entity));

        assertThatThrownBy(() -> registry.updateStatus(entity.getId(), TrainingStatus.TRAINING))
                .isInstanceOf(InvalidTransitionException.class)
                .satisfies(e -> {
                    InvalidTransitionException ite = (InvalidTransitionException) e;
                    assertThat(ite.getFrom()).isEqualTo(TrainingStatus.COMPLETED);
                    assertThat(ite.getTo()).isEqualTo(TrainingStatus.TRAINING);
                });
        assertThat(entity.getTrainingStatus()).isEqualTo(TrainingStatus.COMPLETED);
        verify(repository, never()).save(any());
    }

    @Test
    void updateStatus_sameStatus_isNoOp() {
        ProjectEntity entity = new ProjectEntity("alpha", sourceDir.toString());
        when(repository.findById(entity.getId())).thenReturn(Optional.of(entity));

        ProjectRecord record = registry.updateStatus(entity.getId(), TrainingStatus.PENDING);

        assertThat(record.trainingStatus()).isEqualTo(TrainingStatus.PENDING);
        verify(repository, never()).save(any());
    }

    @Test
    void updateStatus_unknownId_throwsNotFound() {
        when(repository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> registry.updateStatus("nope", TrainingStatus.TRAINING))
                .isInstanceOf(ProjectNotFoundException.class);
    }

    @Test
    void remove_unknownId_throwsNotFound() {
        when(repository.existsById("nope")).thenReturn(false);

        assertThatThrownBy(() -> registry.remove("nope"))
                .isInstanceOf(ProjectNotFoundException.class);
        verify(repository, never()).deleteById(any());
    }

    @Test
    void isReachable_databaseDown_returnsFalse() {
        when(repository.count()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThat(registry.isReachable()).isFalse();
    }
}
