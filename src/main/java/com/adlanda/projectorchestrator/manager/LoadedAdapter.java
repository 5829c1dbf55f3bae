package com.adlanda.projectorchestrator.manager;

import java.nio.file.Path;
import java.time.Instant;

/**
 * An adapter whose configuration has been read and validated.
 *
 * @param projectId Owning project
 * @param path      Adapter directory
 * @param baseModel Base model the adapter was trained on (may be null if not declared)
 * @param rank      LoRA rank, 0 if not declared
 * @param loadedAt  Activation time
 */
public record LoadedAdapter(String projectId, Path path, String baseModel, int rank, Instant loadedAt) {}
