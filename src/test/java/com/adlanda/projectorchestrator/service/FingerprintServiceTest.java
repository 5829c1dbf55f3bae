package com.adlanda.projectorchestrator.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FingerprintService.
 * Tests content hashing and cache key derivation.
 */
class FingerprintServiceTest {

    private FingerprintService service;

    @BeforeEach
    void setUp() {
        service = new FingerprintService("openai:text-embedding-3-small", "1");
    }

    @Test
    void fingerprint_sameContent_returnsSameFingerprint() {
        assertThat(service.fingerprint("class Foo {}")).isEqualTo(service.fingerprint("class Foo {}"));
    }

    @Test
    void fingerprint_differentContent_returnsDifferentFingerprint() {
        assertThat(service.fingerprint("class Foo {}")).isNotEqualTo(service.fingerprint("class Bar {}"));
    }

    @Test
    void fingerprint_lineEndingsAndTrailingWhitespace_areNormalized() {
        String unix = service.fingerprint("line1\nline2");

        assertThat(service.fingerprint("line1\r\nline2")).isEqualTo(unix);
        assertThat(service.fingerprint("line1\rline2")).isEqualTo(unix);
        assertThat(service.fingerprint("line1\nline2  \n\n")).isEqualTo(unix);
    }

    @Test
    void fingerprint_leadingWhitespace_isSignificant() {
        assertThat(service.fingerprint("  indented")).isNotEqualTo(service.fingerprint("indented"));
    }

    @Test
    void fingerprint_otherBackend_returnsDifferentFingerprint() {
        FingerprintService other = new FingerprintService("ollama:nomic-embed-text", "1");

        assertThat(other.fingerprint("same text")).isNotEqualTo(service.fingerprint("same text"));
    }

    @Test
    void fingerprint_otherConfigVersion_returnsDifferentFingerprint() {
        FingerprintService bumped = new FingerprintService("openai:text-embedding-3-small", "2");

        assertThat(bumped.fingerprint("same text")).isNotEqualTo(service.fingerprint("same text"));
    }

    @Test
    void fingerprint_returnsValidSha256Format() {
        assertThat(service.fingerprint("test content"))
                .hasSize(64)
                .matches("[a-f0-9]+");
    }

    @Test
    void computeHash_emptyString_returnsWellKnownHash() {
        assertThat(service.computeHash(""))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void computeHash_file_matchesContentHash(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("Main.java");
        String content = "public class Main {}";
        Files.writeString(file, content);

        assertThat(service.computeHash(file)).isEqualTo(service.computeHash(content));
    }

    @Test
    void computeHash_isNotNormalized() {
        assertThat(service.computeHash("line1\nline2")).isNotEqualTo(service.computeHash("line1\r\nline2"));
    }
}
