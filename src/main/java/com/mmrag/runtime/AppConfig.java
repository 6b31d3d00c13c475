package com.mmrag.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ChunkingConfig chunking = new ChunkingConfig();
    private IngestionConfig ingestion = new IngestionConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private RerankConfig rerank = new RerankConfig();
    private CacheConfig cache = new CacheConfig();
    private StoreConfig store = new StoreConfig();
    private CapabilitiesConfig capabilities = new CapabilitiesConfig();

    public static AppConfig load(Path config) throws IOException {
        if (config == null || !Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion == null ? new IngestionConfig() : ingestion;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public RerankConfig getRerank() {
        return rerank;
    }

    public void setRerank(RerankConfig rerank) {
        this.rerank = rerank == null ? new RerankConfig() : rerank;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache == null ? new CacheConfig() : cache;
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public CapabilitiesConfig getCapabilities() {
        return capabilities;
    }

    public void setCapabilities(CapabilitiesConfig capabilities) {
        this.capabilities = capabilities == null ? new CapabilitiesConfig() : capabilities;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int maxChunkSize = 512;
        private int overlap = 50;

        public int getMaxChunkSize() {
            return maxChunkSize;
        }

        public void setMaxChunkSize(int maxChunkSize) {
            this.maxChunkSize = maxChunkSize;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        private int maxWorkers = 4;
        private int embeddingBatchSize = 32;
        private long maxDocumentBytes = 50_000_000L;
        private int pdfMinTextChars = 20;
        private float pdfRenderDpi = 150f;

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }

        public int getEmbeddingBatchSize() {
            return embeddingBatchSize;
        }

        public void setEmbeddingBatchSize(int embeddingBatchSize) {
            this.embeddingBatchSize = embeddingBatchSize;
        }

        public long getMaxDocumentBytes() {
            return maxDocumentBytes;
        }

        public void setMaxDocumentBytes(long maxDocumentBytes) {
            this.maxDocumentBytes = maxDocumentBytes;
        }

        public int getPdfMinTextChars() {
            return pdfMinTextChars;
        }

        public void setPdfMinTextChars(int pdfMinTextChars) {
            this.pdfMinTextChars = pdfMinTextChars;
        }

        public float getPdfRenderDpi() {
            return pdfRenderDpi;
        }

        public void setPdfRenderDpi(float pdfRenderDpi) {
            this.pdfRenderDpi = pdfRenderDpi;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int defaultResults = 5;
        private int maxResults = 50;
        private double semanticWeight = 0.7;
        private double lexicalWeight = 0.3;
        private int expansionVariants = 3;
        private int shortQueryMaxWords = 2;

        public int getDefaultResults() {
            return defaultResults;
        }

        public void setDefaultResults(int defaultResults) {
            this.defaultResults = defaultResults;
        }

        public int getMaxResults() {
            return maxResults;
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = maxResults;
        }

        public double getSemanticWeight() {
            return semanticWeight;
        }

        public void setSemanticWeight(double semanticWeight) {
            this.semanticWeight = semanticWeight;
        }

        public double getLexicalWeight() {
            return lexicalWeight;
        }

        public void setLexicalWeight(double lexicalWeight) {
            this.lexicalWeight = lexicalWeight;
        }

        public int getExpansionVariants() {
            return expansionVariants;
        }

        public void setExpansionVariants(int expansionVariants) {
            this.expansionVariants = expansionVariants;
        }

        public int getShortQueryMaxWords() {
            return shortQueryMaxWords;
        }

        public void setShortQueryMaxWords(int shortQueryMaxWords) {
            this.shortQueryMaxWords = shortQueryMaxWords;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RerankConfig {
        private double relevanceWeight = 0.75;
        private double recencyWeight = 0.10;
        private double lengthWeight = 0.15;
        private int optimalLength = 500;
        private double recencyHalfLifeDays = 30.0;

        public double getRelevanceWeight() {
            return relevanceWeight;
        }

        public void setRelevanceWeight(double relevanceWeight) {
            this.relevanceWeight = relevanceWeight;
        }

        public double getRecencyWeight() {
            return recencyWeight;
        }

        public void setRecencyWeight(double recencyWeight) {
            this.recencyWeight = recencyWeight;
        }

        public double getLengthWeight() {
            return lengthWeight;
        }

        public void setLengthWeight(double lengthWeight) {
            this.lengthWeight = lengthWeight;
        }

        public int getOptimalLength() {
            return optimalLength;
        }

        public void setOptimalLength(int optimalLength) {
            this.optimalLength = optimalLength;
        }

        public double getRecencyHalfLifeDays() {
            return recencyHalfLifeDays;
        }

        public void setRecencyHalfLifeDays(double recencyHalfLifeDays) {
            this.recencyHalfLifeDays = recencyHalfLifeDays;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CacheConfig {
        private boolean enabled = true;
        private long ttlSeconds = 3600;
        private String snapshotPath = ".mmrag/result-cache.json";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTtlSeconds() {
            return ttlSeconds;
        }

        public void setTtlSeconds(long ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
        }

        public String getSnapshotPath() {
            return snapshotPath;
        }

        public void setSnapshotPath(String snapshotPath) {
            this.snapshotPath = snapshotPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String path = ".mmrag/vector-store.json";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CapabilitiesConfig {
        private long timeoutMs = 30000;
        private int maxRetries = 2;
        private long retryBackoffMs = 250;
        private EmbeddingConfig embedding = new EmbeddingConfig();
        private EndpointConfig captioning = new EndpointConfig();
        private CompletionConfig completion = new CompletionConfig();

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public EmbeddingConfig getEmbedding() {
            return embedding;
        }

        public void setEmbedding(EmbeddingConfig embedding) {
            this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
        }

        public EndpointConfig getCaptioning() {
            return captioning;
        }

        public void setCaptioning(EndpointConfig captioning) {
            this.captioning = captioning == null ? new EndpointConfig() : captioning;
        }

        public CompletionConfig getCompletion() {
            return completion;
        }

        public void setCompletion(CompletionConfig completion) {
            this.completion = completion == null ? new CompletionConfig() : completion;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EndpointConfig {
        private String endpoint;
        private String apiKey;
        private String model;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig extends EndpointConfig {
        private int localDimension = 384;
        private int failureThreshold = 3;
        private long cooldownMs = 60000;

        public int getLocalDimension() {
            return localDimension;
        }

        public void setLocalDimension(int localDimension) {
            this.localDimension = localDimension;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public long getCooldownMs() {
            return cooldownMs;
        }

        public void setCooldownMs(long cooldownMs) {
            this.cooldownMs = cooldownMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CompletionConfig extends EndpointConfig {
        private double temperature = 0.7;
        private int maxTokens = 300;

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }
}
