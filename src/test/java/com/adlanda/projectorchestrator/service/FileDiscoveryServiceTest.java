package com.adlanda.projectorchestrator.service;

import com.adlanda.projectorchestrator.config.WorkspaceProperties;
import com.adlanda.projectorchestrator.exception.DiscoveryTimeoutException;
import com.adlanda.projectorchestrator.exception.FileUtilityException;
import com.adlanda.projectorchestrator.model.DiscoveryResult;
import com.adlanda.projectorchestrator.model.FileDescriptor;
import com.adlanda.projectorchestrator.model.FileType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assumptions.assumeThat;

/**
 * Unit tests for FileDiscoveryService.
 * Tests classification, exclusions, ordering and the wall-clock deadline.
 */
class FileDiscoveryServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    @TempDir
    Path root;

    private WorkspaceProperties properties;
    private FileDiscoveryService service;

    @BeforeEach
    void setUp() {
        properties = new WorkspaceProperties();
        service = new FileDiscoveryService(properties, new FileTypeClassifier());
    }

    @Test
    void scan_tenSourceFiles_returnsTenDescriptors() throws IOException {
        for (int i = 0; i < 10; i++) {
            write("src/File" + i + ".java", "class File" + i + " {}");
        }

        DiscoveryResult result = service.scan(root, TIMEOUT, null);

        assertThat(result.files()).hasSize(10);
        assertThat(result.sourceFiles()).hasSize(10);
        assertThat(result.files()).allSatisfy(f -> {
            assertThat(f.type()).isEqualTo(FileType.SOURCE_CODE);
            assertThat(f.language()).isEqualTo("java");
        });
        assertThat(result.filesVisited()).isEqualTo(10);
    }

    @Test
    void scan_zeroTimeout_throwsBeforeVisitingAnything() throws IOException {
        write("a.py", "print('a')");
        List<String> messages = new ArrayList<>();

        assertThatThrownBy(() -> service.scan(root, Duration.ZERO, messages::add))
                .isInstanceOf(DiscoveryTimeoutException.class)
                .satisfies(e -> assertThat(((DiscoveryTimeoutException) e).getRoot()).isEqualTo(root));
        assertThat(messages).isEmpty();
    }

    @Test
    void scan_expiredDeadline_throwsTimeout() throws IOException {
        for (int i = 0; i < 50; i++) {
            write("dir" + i + "/f.txt", "x");
        }

        assertThatThrownBy(() -> service.scan(root, Duration.ofNanos(1), null))
                .isInstanceOf(DiscoveryTimeoutException.class);
    }

    @Test
    void scan_missingRoot_throwsFileUtilityException() {
        assertThatThrownBy(() -> service.scan(root.resolve("missing"), TIMEOUT, null))
                .isInstanceOf(FileUtilityException.class);
    }

    @Test
    void scan_fileAsRoot_throwsFileUtilityException() throws IOException {
        Path file = write("single.txt", "x");

        assertThatThrownBy(() -> service.scan(file, TIMEOUT, null))
                .isInstanceOf(FileUtilityException.class);
    }

    @Test
    void scan_skipsDefaultExcludedDirectoriesAndFiles() throws IOException {
        write("src/App.java", "class App {}");
        write("node_modules/lib/index.js", "module.exports = {}");
        write(".git/config", "[core]");
        write("target/classes/App.class", "cafebabe");
        write("src/App.class", "cafebabe");
        write("debug.log", "log line");
        write(".env", "SECRET=1");

        DiscoveryResult result = service.scan(root, TIMEOUT, null);

        assertThat(result.files()).extracting(FileDescriptor::relativePath)
                .containsExactly("src/App.java");
    }

    @Test
    void scan_configuredExcludePatterns_areApplied() throws IOException {
        properties.getDiscovery().setExcludePatterns(List.of("*.min.js", "generated"));
        service = new FileDiscoveryService(properties, new FileTypeClassifier());
        write("app.js", "let a = 1;");
        write("app.min.js", "let a=1;");
        write("generated/Model.java", "class Model {}");

        DiscoveryResult result = service.scan(root, TIMEOUT, null);

        assertThat(result.files()).extracting(FileDescriptor::relativePath).containsExactly("app.js");
    }

    @Test
    void scan_resultsAreOrderedByRelativePath() throws IOException {
        write("b.py", "b");
        write("a/z.py", "z");
        write("a/b.py", "b");
        write("c.md", "# c");

        DiscoveryResult result = service.scan(root, TIMEOUT, null);

        assertThat(result.files()).extracting(FileDescriptor::relativePath)
                .containsExactly("a/b.py", "a/z.py", "b.py", "c.md");
    }

    @Test
    void scan_classifiesNonSourceFiles() throws IOException {
        write("notes.txt", "plain text");
        write("logo.png", "png");
        write("data.bin2", "abc\u0000def");
        write("README", "no extension but text");

        DiscoveryResult result = service.scan(root, TIMEOUT, null);

        assertThat(result.files()).extracting(FileDescriptor::relativePath, FileDescriptor::type)
                .containsExactly(
                        tuple("README", FileType.TEXT),
                        tuple("data.bin2", FileType.BINARY),
                        tuple("logo.png", FileType.IMAGE),
                        tuple("notes.txt", FileType.TEXT)
                );
        assertThat(result.sourceFiles()).isEmpty();
    }

    @Test
    void scan_reportsStartAndCompletionProgress() throws IOException {
        write("a.py", "a");
        List<String> messages = new ArrayList<>();

        service.scan(root, TIMEOUT, messages::add);

        assertThat(messages).hasSizeGreaterThanOrEqualTo(2);
        assertThat(messages.get(0)).startsWith("Scanning");
        assertThat(messages.get(messages.size() - 1)).startsWith("Found 1 files");
    }

    @Test
    void scan_zeroProgressInterval_reportsEveryFile() throws IOException {
        properties.getDiscovery().setProgressInterval(Duration.ZERO);
        service = new FileDiscoveryService(properties, new FileTypeClassifier());
        for (int i = 0; i < 3; i++) {
            write("File" + i + ".java", "class File" + i + " {}");
        }
        List<String> messages = new ArrayList<>();

        service.scan(root, TIMEOUT, messages::add);

        assertThat(messages).filteredOn(m -> m.startsWith("Scanned "))
                .containsExactly("Scanned 1 files...", "Scanned 2 files...", "Scanned 3 files...");
    }

    @Test
    void scan_failingProgressSink_doesNotAbortScan() throws IOException {
        write("a.py", "a");

        DiscoveryResult result = service.scan(root, TIMEOUT, message -> {
            throw new IllegalStateException("UI gone");
        });

        assertThat(result.files()).hasSize(1);
    }

    @Test
    void scan_brokenSymlink_isSkippedAndCounted() throws IOException {
        write("real.py", "x = 1");
        try {
            Files.createSymbolicLink(root.resolve("dangling.py"), root.resolve("does-not-exist.py"));
        } catch (UnsupportedOperationException | IOException e) {
            assumeThat(false).as("symbolic links not supported here").isTrue();
        }

        DiscoveryResult result = service.scan(root, TIMEOUT, null);

        assertThat(result.files()).extracting(FileDescriptor::relativePath).containsExactly("real.py");
        assertThat(result.entriesSkipped()).isEqualTo(1);
    }

    @Test
    void scan_symlinkedRoot_walksTheTarget(@TempDir Path linkParent) throws IOException {
        for (int i = 0; i < 10; i++) {
            write("src/File" + i + ".java", "class File" + i + " {}");
        }
        Path link = linkParent.resolve("project-link");
        try {
            Files.createSymbolicLink(link, root);
        } catch (UnsupportedOperationException | IOException e) {
            assumeThat(false).as("symbolic links not supported here").isTrue();
        }

        DiscoveryResult result = service.scan(link, TIMEOUT, null);

        assertThat(result.files()).hasSize(10);
        assertThat(result.files()).extracting(FileDescriptor::relativePath).contains("src/File0.java");
    }

    @Test
    void scan_nullTimeout_throwsFileUtilityException() throws IOException {
        write("a.py", "a");

        assertThatThrownBy(() -> service.scan(root, null, null))
                .isInstanceOf(FileUtilityException.class);
    }

    @Test
    void scan_hugeTimeout_completesNormally() throws IOException {
        write("a.py", "a");

        DiscoveryResult result = service.scan(root, Duration.ofSeconds(Long.MAX_VALUE), null);

        assertThat(result.files()).hasSize(1);
    }

    @Test
    void budgetNanos_saturatesLargeTimeouts() {
        assertThat(FileDiscoveryService.budgetNanos(Duration.ofSeconds(2))).isEqualTo(2_000_000_000L);
        assertThat(FileDiscoveryService.budgetNanos(Duration.ofSeconds(Long.MAX_VALUE))).isEqualTo(Long.MAX_VALUE / 2);
    }

    @Test
    void scan_usesConfiguredDefaultTimeout() throws IOException {
        write("a.py", "a");

        assertThat(service.scan(root, null).files()).hasSize(1);
    }

    private Path write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
