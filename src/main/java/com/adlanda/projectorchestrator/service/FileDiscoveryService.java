package com.adlanda.projectorchestrator.service;

import com.adlanda.projectorchestrator.config.WorkspaceProperties;
import com.adlanda.projectorchestrator.exception.DiscoveryTimeoutException;
import com.adlanda.projectorchestrator.exception.FileUtilityException;
import com.adlanda.projectorchestrator.model.FileDescriptor;
import com.adlanda.projectorchestrator.model.FileType;
import com.adlanda.projectorchestrator.model.DiscoveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Walks a project tree and lists its files, bounded by a wall-clock deadline.
 *
 * The walk runs on its own worker thread. When the deadline passes the caller
 * gets a {@link DiscoveryTimeoutException} and the worker is interrupted; the
 * visitor also checks the deadline before every entry, so it stops even when
 * the file system ignores interrupts.
 */
@Service
public class FileDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(FileDiscoveryService.class);

    static final Set<String> DEFAULT_EXCLUDED_DIRS = Set.of(
            ".git", ".svn", ".hg", "node_modules", "__pycache__", ".pytest_cache",
            "venv", "env", "vendor", "target", "build", "dist", ".tox",
            ".vscode", ".idea", ".cache"
    );

    static final List<String> DEFAULT_EXCLUDED_FILE_GLOBS = List.of(
            "*.pyc", "*.class", "*.o", "*.so", "*.dll", "*.exe", "*.log", "*.tmp", "*.swp"
    );

    // Deadlines are compared by difference, which stays exact below 2^62 ns.
    private static final Duration MAX_BUDGET = Duration.ofNanos(Long.MAX_VALUE / 2);

    private final FileTypeClassifier classifier;
    private final Duration defaultTimeout;
    private final Duration progressInterval;
    private final List<PathMatcher> excludedNames;

    public FileDiscoveryService(WorkspaceProperties properties, FileTypeClassifier classifier) {
        this.classifier = classifier;
        this.defaultTimeout = properties.getDiscovery().getTimeout();
        this.progressInterval = properties.getDiscovery().getProgressInterval();

        List<PathMatcher> matchers = new ArrayList<>();
        for (String glob : DEFAULT_EXCLUDED_FILE_GLOBS) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        }
        for (String glob : properties.getDiscovery().getExcludePatterns()) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        }
        this.excludedNames = List.copyOf(matchers);
    }

    /**
     * Scans with the configured default timeout.
     */
    public DiscoveryResult scan(Path root, ProgressSink sink) {
        return scan(root, defaultTimeout, sink);
    }

    /**
     * Lists every non-excluded file under {@code root}.
     *
     * @param root    Directory to scan
     * @param timeout Wall-clock limit; zero or negative expires immediately
     * @param sink    Receives throttled progress messages, may be null
     * @return the files, ordered by relative path
     * @throws DiscoveryTimeoutException if the scan does not finish in time
     * @throws FileUtilityException      if the root is not a readable directory or the walk fails (also for a null timeout)
     */
    public DiscoveryResult scan(Path root, Duration timeout, ProgressSink sink) {
        if (root == null || !Files.isDirectory(root)) {
            throw new FileUtilityException("Not a directory: " + root);
        }
        if (timeout == null) {
            throw new FileUtilityException("No timeout given for scanning " + root);
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new DiscoveryTimeoutException(root, timeout);
        }

        // A symlinked root is walked through its target.
        Path realRoot;
        try {
            realRoot = root.toRealPath();
        } catch (IOException e) {
            throw new FileUtilityException("Cannot resolve " + root, e);
        }

        ProgressSink progress = sink != null ? sink : ProgressSink.NONE;
        long start = System.nanoTime();
        long deadline = start + budgetNanos(timeout);

        ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "file-discovery");
            t.setDaemon(true);
            return t;
        });
        try {
            Future<DiscoveryResult> future = worker.submit(() -> walk(realRoot, start, deadline, timeout, progress));
            try {
                return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Discovery of {} timed out after {} ms", root, timeout.toMillis());
                throw new DiscoveryTimeoutException(root, timeout);
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new FileUtilityException("Interrupted while scanning " + root, e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof DiscoveryTimeoutException) {
                    throw (DiscoveryTimeoutException) cause;
                }
                if (cause instanceof FileUtilityException) {
                    throw (FileUtilityException) cause;
                }
                throw new FileUtilityException("Failed to scan " + root, cause);
            }
        } finally {
            worker.shutdownNow();
        }
    }

    /**
     * Timeout in nanoseconds, saturated so that {@code start + budget} cannot overflow.
     */
    static long budgetNanos(Duration timeout) {
        if (timeout.compareTo(MAX_BUDGET) >= 0) {
            return MAX_BUDGET.toNanos();
        }
        return timeout.toNanos();
    }

    private DiscoveryResult walk(Path root, long start, long deadline, Duration timeout, ProgressSink sink)
            throws IOException {
        report(sink, "Scanning " + root);
        Visitor visitor = new Visitor(root, deadline, timeout, sink);
        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, visitor);

        List<FileDescriptor> files = visitor.files;
        files.sort(Comparator.comparing(FileDescriptor::relativePath));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        long sources = files.stream().filter(FileDescriptor::source).count();
        report(sink, String.format("Found %d files (%d source) in %d ms", files.size(), sources, elapsed.toMillis()));
        log.info("Discovered {} files ({} source, {} skipped) under {} in {} ms",
                files.size(), sources, visitor.skipped, root, elapsed.toMillis());

        return new DiscoveryResult(root, List.copyOf(files), visitor.visited, visitor.skipped, elapsed);
    }

    private void report(ProgressSink sink, String message) {
        try {
            sink.onProgress(message);
        } catch (RuntimeException e) {
            log.warn("Progress sink failed: {}", e.getMessage());
        }
    }

    private boolean isExcludedFile(Path name) {
        for (PathMatcher matcher : excludedNames) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isHidden(Path name) {
        return name.toString().startsWith(".");
    }

    private class Visitor extends SimpleFileVisitor<Path> {

        private final Path root;
        private final long deadline;
        private final Duration timeout;
        private final ProgressSink sink;
        private final List<FileDescriptor> files = new ArrayList<>();
        private long lastProgress;
        private int visited;
        private int skipped;

        Visitor(Path root, long deadline, Duration timeout, ProgressSink sink) {
            this.root = root;
            this.deadline = deadline;
            this.timeout = timeout;
            this.sink = sink;
            this.lastProgress = System.nanoTime();
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            checkDeadline();
            if (dir.equals(root)) {
                return FileVisitResult.CONTINUE;
            }
            Path name = dir.getFileName();
            if (isHidden(name) || DEFAULT_EXCLUDED_DIRS.contains(name.toString()) || isExcludedFile(name)) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            checkDeadline();
            Path name = file.getFileName();
            if (isHidden(name)) {
                return FileVisitResult.CONTINUE;
            }
            visited++;
            if (isExcludedFile(name)) {
                return FileVisitResult.CONTINUE;
            }

            long size = attrs.size();
            if (attrs.isSymbolicLink()) {
                // Links to regular files are listed, links to directories are not followed.
                if (!Files.exists(file)) {
                    skipped++;
                    return FileVisitResult.CONTINUE;
                }
                if (!Files.isRegularFile(file)) {
                    return FileVisitResult.CONTINUE;
                }
                try {
                    size = Files.size(file);
                } catch (IOException e) {
                    skipped++;
                    return FileVisitResult.CONTINUE;
                }
            } else if (!attrs.isRegularFile()) {
                return FileVisitResult.CONTINUE;
            }

            try {
                FileType type = classifier.classify(file, size);
                boolean source = type == FileType.SOURCE_CODE;
                files.add(new FileDescriptor(
                        file,
                        root.relativize(file).toString().replace('\\', '/'),
                        type,
                        source,
                        size,
                        source ? classifier.languageOf(file) : null
                ));
            } catch (IOException e) {
                log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
                skipped++;
            }

            long now = System.nanoTime();
            if (now - lastProgress >= progressInterval.toNanos()) {
                lastProgress = now;
                report(sink, "Scanned " + visited + " files...");
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            checkDeadline();
            if (file.equals(root)) {
                throw new FileUtilityException("Cannot read " + root, exc);
            }
            log.debug("Skipping {}: {}", file, exc.getMessage());
            skipped++;
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (exc != null) {
                log.debug("Directory listing of {} incomplete: {}", dir, exc.getMessage());
                skipped++;
            }
            return FileVisitResult.CONTINUE;
        }

        private void checkDeadline() {
            if (Thread.currentThread().isInterrupted() || System.nanoTime() - deadline >= 0) {
                throw new DiscoveryTimeoutException(root, timeout);
            }
        }
    }
}
