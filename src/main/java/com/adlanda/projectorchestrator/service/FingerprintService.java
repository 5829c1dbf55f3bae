package com.adlanda.projectorchestrator.service;

import com.adlanda.projectorchestrator.config.WorkspaceProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes content hashes and embedding cache fingerprints.
 *
 * A fingerprint covers the normalized text, the embedding backend identity
 * and the backend configuration version. Switching backend or bumping the
 * config version therefore produces new fingerprints; old cache entries are
 * simply never addressed again.
 */
@Service
public class FingerprintService {

    private static final char SEPARATOR = '\u0000';

    private final String backendId;
    private final String configVersion;

    @Autowired
    public FingerprintService(WorkspaceProperties properties) {
        this(properties.getEmbedding().getBackendId(), properties.getEmbedding().getConfigVersion());
    }

    public FingerprintService(String backendId, String configVersion) {
        this.backendId = backendId;
        this.configVersion = configVersion;
    }

    /**
     * Fingerprint of a text to embed with the configured backend.
     *
     * @return 64 hex characters
     */
    public String fingerprint(String content) {
        String key = normalize(content) + SEPARATOR + backendId + SEPARATOR + configVersion;
        return computeHash(key);
    }

    /**
     * Line endings become '\n' and trailing whitespace is dropped, so the
     * same text checked out on different platforms shares one cache entry.
     */
    static String normalize(String content) {
        return content.replace("\r\n", "\n").replace('\r', '\n').stripTrailing();
    }

    /**
     * Computes the SHA-256 hash of a file's content.
     *
     * @param filePath Path to the file
     * @return Hexadecimal string representation of the hash (64 characters)
     * @throws IOException If the file cannot be read
     */
    public String computeHash(Path filePath) throws IOException {
        return HexFormat.of().formatHex(sha256().digest(Files.readAllBytes(filePath)));
    }

    /**
     * Computes the SHA-256 hash of a string content (UTF-8).
     */
    public String computeHash(String content) {
        return HexFormat.of().formatHex(sha256().digest(content.getBytes(StandardCharsets.UTF_8)));
    }

    public String getBackendId() {
        return backendId;
    }

    public String getConfigVersion() {
        return configVersion;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is always available in standard JVMs
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
