package com.adlanda.projectorchestrator.model;

import java.nio.file.Path;

/**
 * A file found by discovery.
 *
 * @param path         Absolute path of the file
 * @param relativePath Path relative to the scanned root, with '/' separators
 * @param type         Detected file type
 * @param source       True when the file is recognized source code
 * @param size         Size in bytes (-1 when it could not be read)
 * @param language     Programming language for known source extensions, otherwise null
 */
public record FileDescriptor(
        Path path,
        String relativePath,
        FileType type,
        boolean source,
        long size,
        String language
) {}
