package com.adlanda.projectorchestrator.repository;

import com.adlanda.projectorchestrator.model.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.zip.CRC32;

/**
 * Persistent tier of the embedding cache: one small binary file per fingerprint.
 *
 * Layout: {@code <dir>/<first two hex chars>/<fingerprint>.vec}, containing
 * magic, format version, creation time, dimension, the floats and a CRC32 of
 * everything before it.
 *
 * Entries are written to a temporary file in the target directory, forced to
 * disk and then renamed into place, so a reader either sees a complete entry
 * or no entry. Files that fail validation (torn writes from older crashes,
 * manual tampering) are reported as misses and removed.
 */
public class EmbeddingFileStore {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingFileStore.class);

    static final int MAGIC = 0x45564543; // "EVEC"
    static final int FORMAT_VERSION = 1;
    private static final int HEADER_BYTES = 4 + 4 + 8 + 4;
    private static final int TRAILER_BYTES = 8;
    private static final String SUFFIX = ".vec";
    private static final Pattern FINGERPRINT = Pattern.compile("[0-9a-f]{8,128}");

    private final Path directory;

    public EmbeddingFileStore(Path directory) {
        this.directory = directory;
    }

    /**
     * Reads the entry for a fingerprint.
     *
     * @return the entry, or empty when it is absent or unreadable
     */
    public Optional<CacheEntry> read(String fingerprint) {
        Path file = pathFor(fingerprint);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            byte[] bytes = Files.readAllBytes(file);
            CacheEntry entry = decode(fingerprint, bytes);
            if (entry == null) {
                log.warn("Discarding corrupt cache entry {}", file);
                Files.deleteIfExists(file);
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (IOException e) {
            log.warn("Failed to read cache entry {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Persists an entry. An existing entry for the same fingerprint is kept as is.
     *
     * @throws IOException if the entry could not be published
     */
    public void write(String fingerprint, float[] vector, Instant createdAt) throws IOException {
        Path target = pathFor(fingerprint);
        if (Files.exists(target)) {
            return;
        }
        Path dir = target.getParent();
        Files.createDirectories(dir);

        Path temp = Files.createTempFile(dir, fingerprint, ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = encode(vector, createdAt);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            publish(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public boolean contains(String fingerprint) {
        return Files.isRegularFile(pathFor(fingerprint));
    }

    /**
     * Number of published entries on disk.
     */
    public long count() {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        try (Stream<Path> files = Files.walk(directory, 2)) {
            return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).count();
        } catch (IOException e) {
            log.warn("Failed to count cache entries in {}: {}", directory, e.getMessage());
            return 0;
        }
    }

    /**
     * Deletes every entry and leftover temporary file.
     */
    public void clear() throws IOException {
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (Stream<Path> files = Files.walk(directory, 2)) {
            for (Path p : files.filter(Files::isRegularFile).toList()) {
                String name = p.getFileName().toString();
                if (name.endsWith(SUFFIX) || name.endsWith(".tmp")) {
                    Files.deleteIfExists(p);
                }
            }
        }
    }

    public Path getDirectory() {
        return directory;
    }

    Path pathFor(String fingerprint) {
        if (fingerprint == null || !FINGERPRINT.matcher(fingerprint).matches()) {
            throw new IllegalArgumentException("Not a hex fingerprint: " + fingerprint);
        }
        return directory.resolve(fingerprint.substring(0, 2)).resolve(fingerprint + SUFFIX);
    }

    private static void publish(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static ByteBuffer encode(float[] vector, Instant createdAt) {
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + vector.length * Float.BYTES + TRAILER_BYTES);
        buffer.putInt(MAGIC)
              .putInt(FORMAT_VERSION)
              .putLong(createdAt.toEpochMilli())
              .putInt(vector.length);
        for (float v : vector) {
            buffer.putFloat(v);
        }
        CRC32 crc = new CRC32();
        crc.update(buffer.array(), 0, buffer.position());
        buffer.putLong(crc.getValue());
        buffer.flip();
        return buffer;
    }

    static CacheEntry decode(String fingerprint, byte[] bytes) {
        if (bytes.length < HEADER_BYTES + TRAILER_BYTES) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        if (buffer.getInt() != MAGIC || buffer.getInt() != FORMAT_VERSION) {
            return null;
        }
        long createdAt = buffer.getLong();
        int dimensions = buffer.getInt();
        if (dimensions < 0 || bytes.length != HEADER_BYTES + (long) dimensions * Float.BYTES + TRAILER_BYTES) {
            return null;
        }
        float[] vector = new float[dimensions];
        for (int i = 0; i < dimensions; i++) {
            vector[i] = buffer.getFloat();
        }
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, buffer.position());
        if (buffer.getLong() != crc.getValue()) {
            return null;
        }
        return new CacheEntry(fingerprint, vector, Instant.ofEpochMilli(createdAt), bytes.length);
    }
}
