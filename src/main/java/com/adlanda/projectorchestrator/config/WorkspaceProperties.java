package com.adlanda.projectorchestrator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for projects and their derived artifacts.
 *
 * Maps to properties prefixed with 'workspace' in application.properties.
 * Per-project artifact locations are derived from the directories below
 * and the project id; when a directory is not set it defaults to a
 * sub-directory of {@code data-dir}.
 */
@Component
@ConfigurationProperties(prefix = "workspace")
@Validated
public class WorkspaceProperties {

    /**
     * Root directory for all derived data.
     */
    private String dataDir = "./data";

    /**
     * Directory holding one adapter directory per project ({@code <adapters-dir>/<project-id>}).
     */
    private String adaptersDir;

    /**
     * Directory holding one vector index file per project ({@code <vector-stores-dir>/<project-id>.json}).
     */
    private String vectorStoresDir;

    /**
     * Directory holding one conversation file per project ({@code <contexts-dir>/<project-id>.json}).
     */
    private String contextsDir;

    @Valid
    private Embedding embedding = new Embedding();
    @Valid
    private Discovery discovery = new Discovery();
    @Valid
    private Switching switching = new Switching();
    @Valid
    private Context context = new Context();
    @Valid
    private Ingestion ingestion = new Ingestion();

    public Path resolveDataDir() {
        return Path.of(dataDir);
    }

    public Path resolveAdaptersDir() {
        return adaptersDir != null ? Path.of(adaptersDir) : resolveDataDir().resolve("adapters");
    }

    public Path resolveVectorStoresDir() {
        return vectorStoresDir != null ? Path.of(vectorStoresDir) : resolveDataDir().resolve("vector-stores");
    }

    public Path resolveContextsDir() {
        return contextsDir != null ? Path.of(contextsDir) : resolveDataDir().resolve("contexts");
    }

    public Path resolveEmbeddingCacheDir() {
        return embedding.cacheDir != null ? Path.of(embedding.cacheDir) : resolveDataDir().resolve("embedding-cache");
    }

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getAdaptersDir() {
        return adaptersDir;
    }

    public void setAdaptersDir(String adaptersDir) {
        this.adaptersDir = adaptersDir;
    }

    public String getVectorStoresDir() {
        return vectorStoresDir;
    }

    public void setVectorStoresDir(String vectorStoresDir) {
        this.vectorStoresDir = vectorStoresDir;
    }

    public String getContextsDir() {
        return contextsDir;
    }

    public void setContextsDir(String contextsDir) {
        this.contextsDir = contextsDir;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public void setEmbedding(Embedding embedding) {
        this.embedding = embedding;
    }

    public Discovery getDiscovery() {
        return discovery;
    }

    public void setDiscovery(Discovery discovery) {
        this.discovery = discovery;
    }

    public Switching getSwitching() {
        return switching;
    }

    public void setSwitching(Switching switching) {
        this.switching = switching;
    }

    public Context getContext() {
        return context;
    }

    public void setContext(Context context) {
        this.context = context;
    }

    public Ingestion getIngestion() {
        return ingestion;
    }

    public void setIngestion(Ingestion ingestion) {
        this.ingestion = ingestion;
    }

    public static class Embedding {

        /**
         * Identity of the embedding backend. Part of every cache fingerprint,
         * so changing it makes all existing cache entries unreachable.
         */
        private String backendId = "openai:text-embedding-3-small";

        /**
         * Version of the backend configuration. Bump it when backend options change.
         */
        private String configVersion = "1";

        /**
         * Directory of the persistent cache tier.
         */
        private String cacheDir;

        /**
         * Entry ceiling of the in-memory tier; least recently used entries are evicted beyond it.
         */
        @Min(1)
        private int maxMemoryEntries = 10_000;

        public String getBackendId() { return backendId; }
        public void setBackendId(String backendId) { this.backendId = backendId; }
        public String getConfigVersion() { return configVersion; }
        public void setConfigVersion(String configVersion) { this.configVersion = configVersion; }
        public String getCacheDir() { return cacheDir; }
        public void setCacheDir(String cacheDir) { this.cacheDir = cacheDir; }
        public int getMaxMemoryEntries() { return maxMemoryEntries; }
        public void setMaxMemoryEntries(int maxMemoryEntries) { this.maxMemoryEntries = maxMemoryEntries; }
    }

    public static class Discovery {

        /**
         * Default wall-clock limit of a scan.
         */
        private Duration timeout = Duration.ofSeconds(30);

        /**
         * Minimum time between two progress messages.
         */
        private Duration progressInterval = Duration.ofMillis(250);

        /**
         * Extra file or directory globs to exclude, on top of the built-in ones.
         */
        private List<String> excludePatterns = new ArrayList<>();

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public Duration getProgressInterval() { return progressInterval; }
        public void setProgressInterval(Duration progressInterval) { this.progressInterval = progressInterval; }
        public List<String> getExcludePatterns() { return excludePatterns; }
        public void setExcludePatterns(List<String> excludePatterns) { this.excludePatterns = excludePatterns; }
    }

    public static class Switching {

        /**
         * How long a switch request waits for another switch to finish before giving up.
         */
        private Duration lockTimeout = Duration.ofSeconds(30);

        /**
         * Project to activate at startup. Empty means none.
         */
        private String startupProject;

        public Duration getLockTimeout() { return lockTimeout; }
        public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }
        public String getStartupProject() { return startupProject; }
        public void setStartupProject(String startupProject) { this.startupProject = startupProject; }
    }

    public static class Context {

        /**
         * Messages kept per project; older ones are dropped.
         */
        @Min(1)
        private int maxMessages = 50;

        /**
         * Default size of the recent-context window handed to the model.
         */
        private int maxContextChars = 4000;

        public int getMaxMessages() { return maxMessages; }
        public void setMaxMessages(int maxMessages) { this.maxMessages = maxMessages; }
        public int getMaxContextChars() { return maxContextChars; }
        public void setMaxContextChars(int maxContextChars) { this.maxContextChars = maxContextChars; }
    }

    public static class Ingestion {

        /**
         * Approximate chunk size in tokens (~4 characters per token).
         */
        @Min(1)
        private int maxTokens = 512;

        /**
         * Source files larger than this are not indexed.
         */
        private long maxFileBytes = 1024 * 1024;

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
        public long getMaxFileBytes() { return maxFileBytes; }
        public void setMaxFileBytes(long maxFileBytes) { this.maxFileBytes = maxFileBytes; }
    }
}
