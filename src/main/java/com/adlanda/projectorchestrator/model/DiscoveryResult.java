package com.adlanda.projectorchestrator.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Outcome of one completed discovery scan. Never represents a timed-out scan.
 *
 * @param root           The scanned root directory
 * @param files          Discovered files, ordered by relative path
 * @param filesVisited   Number of regular files the walk looked at (including excluded ones)
 * @param entriesSkipped Entries that could not be read (permissions, broken links, ...)
 * @param elapsed        Wall-clock duration of the scan
 */
public record DiscoveryResult(
        Path root,
        List<FileDescriptor> files,
        int filesVisited,
        int entriesSkipped,
        Duration elapsed
) {
    public List<FileDescriptor> sourceFiles() {
        return files.stream().filter(FileDescriptor::source).toList();
    }
}
