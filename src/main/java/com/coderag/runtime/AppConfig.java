package com.coderag.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StorageConfig storage = new StorageConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private IndexingConfig indexing = new IndexingConfig();
    private WatchConfig watch = new WatchConfig();

    static final String DEFAULTS_RESOURCE = "/application.yml";

    /**
     * Reads {@code config}, or the bundled {@code application.yml} when the file does not exist.
     */
    public static AppConfig load(Path config) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        if (config == null || !Files.exists(config)) {
            try (InputStream defaults = AppConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
                if (defaults == null) {
                    return new AppConfig();
                }
                AppConfig loaded = mapper.readValue(defaults, AppConfig.class);
                return loaded == null ? new AppConfig() : loaded;
            }
        }
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public IndexingConfig getIndexing() {
        return indexing;
    }

    public void setIndexing(IndexingConfig indexing) {
        this.indexing = indexing == null ? new IndexingConfig() : indexing;
    }

    public WatchConfig getWatch() {
        return watch;
    }

    public void setWatch(WatchConfig watch) {
        this.watch = watch == null ? new WatchConfig() : watch;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String dataDir = System.getProperty("user.home") + "/.code-rag";

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir;
        }

        public Path collectionsDir() {
            String dir = dataDir;
            if (dir.equals("~") || dir.startsWith("~/")) {
                dir = System.getProperty("user.home") + dir.substring(1);
            }
            return Path.of(dir).resolve("collections");
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "";
        private boolean allowLocalFallback;
        private int batchSize = 20;
        private int maxAttempts = 3;
        private long retryBaseDelayMs = 1000;
        private int timeoutSeconds = 120;
        private String ollamaHost = "http://localhost:11434";
        private String ollamaModel = "nomic-embed-text";
        private String openaiModel = "text-embedding-3-small";
        private String voyageModel = "voyage-3-lite";
        private String googleModel = "text-embedding-004";
        private int localDimensions = 384;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider == null ? "" : provider;
        }

        public boolean isAllowLocalFallback() {
            return allowLocalFallback;
        }

        public void setAllowLocalFallback(boolean allowLocalFallback) {
            this.allowLocalFallback = allowLocalFallback;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getRetryBaseDelayMs() {
            return retryBaseDelayMs;
        }

        public void setRetryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = retryBaseDelayMs;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public String getOllamaHost() {
            return ollamaHost;
        }

        public void setOllamaHost(String ollamaHost) {
            this.ollamaHost = ollamaHost;
        }

        public String getOllamaModel() {
            return ollamaModel;
        }

        public void setOllamaModel(String ollamaModel) {
            this.ollamaModel = ollamaModel;
        }

        public String getOpenaiModel() {
            return openaiModel;
        }

        public void setOpenaiModel(String openaiModel) {
            this.openaiModel = openaiModel;
        }

        public String getVoyageModel() {
            return voyageModel;
        }

        public void setVoyageModel(String voyageModel) {
            this.voyageModel = voyageModel;
        }

        public String getGoogleModel() {
            return googleModel;
        }

        public void setGoogleModel(String googleModel) {
            this.googleModel = googleModel;
        }

        public int getLocalDimensions() {
            return localDimensions;
        }

        public void setLocalDimensions(int localDimensions) {
            this.localDimensions = localDimensions;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexingConfig {
        private long maxFileSizeBytes = 500_000;
        private boolean astChunking = true;
        private List<String> extraIgnoredDirectories = List.of();
        private List<String> extraIgnoredExtensions = List.of();

        public long getMaxFileSizeBytes() {
            return maxFileSizeBytes;
        }

        public void setMaxFileSizeBytes(long maxFileSizeBytes) {
            this.maxFileSizeBytes = maxFileSizeBytes;
        }

        public boolean isAstChunking() {
            return astChunking;
        }

        public void setAstChunking(boolean astChunking) {
            this.astChunking = astChunking;
        }

        public List<String> getExtraIgnoredDirectories() {
            return extraIgnoredDirectories;
        }

        public void setExtraIgnoredDirectories(List<String> extraIgnoredDirectories) {
            this.extraIgnoredDirectories = extraIgnoredDirectories == null ? List.of() : extraIgnoredDirectories;
        }

        public List<String> getExtraIgnoredExtensions() {
            return extraIgnoredExtensions;
        }

        public void setExtraIgnoredExtensions(List<String> extraIgnoredExtensions) {
            this.extraIgnoredExtensions = extraIgnoredExtensions == null ? List.of() : extraIgnoredExtensions;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WatchConfig {
        private long debounceMs = 2000;

        public long getDebounceMs() {
            return debounceMs;
        }

        public void setDebounceMs(long debounceMs) {
            this.debounceMs = debounceMs;
        }
    }
}
