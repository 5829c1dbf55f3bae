package com.adlanda.projectorchestrator.manager;

import com.adlanda.projectorchestrator.config.WorkspaceProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Keeps the fine-tuned adapter of the active project loaded.
 *
 * Adapters are produced by the external training pipeline as
 * {@code <adapters-dir>/<project-id>/adapter_config.json} plus weights.
 * Only the configuration is read here; the inference backend picks the
 * weights up from {@link LoadedAdapter#path()}.
 */
@Component
public class AdapterLoaderManager extends AbstractResourceManager {

    public static final String NAME = "model-loader";
    static final String CONFIG_FILE = "adapter_config.json";

    private final Path adaptersDir;
    private final ObjectMapper objectMapper;

    private LoadedAdapter loaded;

    @Autowired
    public AdapterLoaderManager(WorkspaceProperties properties, ObjectMapper objectMapper) {
        this(properties.resolveAdaptersDir(), objectMapper);
    }

    AdapterLoaderManager(Path adaptersDir, ObjectMapper objectMapper) {
        this.adaptersDir = adaptersDir;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    public Optional<LoadedAdapter> getLoadedAdapter() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(loaded);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Path adapterPath(String projectId) {
        requireValidId(projectId);
        return adaptersDir.resolve(projectId);
    }

    @Override
    protected Path artifactPath(String projectId) {
        return adapterPath(projectId);
    }

    @Override
    protected boolean activate(String projectId) {
        Path dir = adapterPath(projectId);
        if (!Files.isDirectory(dir)) {
            log.warn("No adapter for project {} at {}", projectId, dir);
            return false;
        }
        Path config = dir.resolve(CONFIG_FILE);
        if (!Files.isRegularFile(config)) {
            log.warn("Adapter of project {} has no {}", projectId, CONFIG_FILE);
            return false;
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(config.toFile());
        } catch (IOException e) {
            log.warn("Unreadable adapter config {}: {}", config, e.getMessage());
            return false;
        }
        if (node == null || !node.isObject()) {
            log.warn("Adapter config {} is not a JSON object", config);
            return false;
        }

        loaded = new LoadedAdapter(
                projectId,
                dir,
                node.path("base_model_name_or_path").asText(null),
                node.path("r").asInt(0),
                Instant.now()
        );
        log.debug("Adapter for {}: base model {}, rank {}", projectId, loaded.baseModel(), loaded.rank());
        return true;
    }

    @Override
    protected void release(String projectId) {
        loaded = null;
    }
}
