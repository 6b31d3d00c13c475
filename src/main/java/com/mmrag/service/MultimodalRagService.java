package com.mmrag.service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mmrag.answer.Answer;
import com.mmrag.answer.AnswerService;
import com.mmrag.cache.ResultCache;
import com.mmrag.capability.CapabilityInvoker;
import com.mmrag.capability.CapabilityServices;
import com.mmrag.capability.CaptioningService;
import com.mmrag.capability.CompletionService;
import com.mmrag.capability.EmbeddingService;
import com.mmrag.chunk.Chunker;
import com.mmrag.document.Document;
import com.mmrag.document.DocumentLoader;
import com.mmrag.error.ValidationException;
import com.mmrag.ingest.BatchIngestionReport;
import com.mmrag.ingest.IngestionPipeline;
import com.mmrag.ingest.IngestionResult;
import com.mmrag.normalize.ImageNormalizer;
import com.mmrag.normalize.PdfNormalizer;
import com.mmrag.normalize.TextNormalizer;
import com.mmrag.query.QueryClassifier;
import com.mmrag.query.QueryIntent;
import com.mmrag.retrieval.ExpandedRetriever;
import com.mmrag.retrieval.HybridRetriever;
import com.mmrag.retrieval.Reranker;
import com.mmrag.retrieval.RetrievalEngine;
import com.mmrag.retrieval.RetrievalRequest;
import com.mmrag.retrieval.RetrievalResult;
import com.mmrag.retrieval.SemanticRetriever;
import com.mmrag.runtime.AppConfig;
import com.mmrag.store.VectorStore;

import okhttp3.OkHttpClient;

/**
 * Entry point for callers: document ingestion, retrieval, intent classification, answers and
 * housekeeping over one vector store and one result cache.
 */
public class MultimodalRagService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MultimodalRagService.class);

    private final VectorStore store;
    private final ResultCache cache;
    private final DocumentLoader loader;
    private final IngestionPipeline pipeline;
    private final RetrievalEngine engine;
    private final AnswerService answerService;
    private final CapabilityInvoker invoker;

    public MultimodalRagService(
            VectorStore store,
            ResultCache cache,
            DocumentLoader loader,
            IngestionPipeline pipeline,
            RetrievalEngine engine,
            AnswerService answerService,
            CapabilityInvoker invoker) {
        this.store = store;
        this.cache = cache;
        this.loader = loader;
        this.pipeline = pipeline;
        this.engine = engine;
        this.answerService = answerService;
        this.invoker = invoker;
        pipeline.addInvalidationListener(cache::invalidateAll);
    }

    public static MultimodalRagService create(AppConfig config, VectorStore store, ResultCache cache, OkHttpClient httpClient) {
        AppConfig.CapabilitiesConfig capabilities = config.getCapabilities();
        EmbeddingService embedding = CapabilityServices.embedding(capabilities.getEmbedding(), httpClient);
        CaptioningService captioning = CapabilityServices.captioning(capabilities.getCaptioning(), httpClient);
        Optional<CompletionService> completion = CapabilityServices.completion(capabilities.getCompletion(), httpClient);
        return create(config, store, cache, embedding, captioning, completion);
    }

    public static MultimodalRagService create(
            AppConfig config,
            VectorStore store,
            ResultCache cache,
            EmbeddingService embedding,
            CaptioningService captioning,
            Optional<CompletionService> completion) {
        AppConfig.CapabilitiesConfig capabilities = config.getCapabilities();
        AppConfig.IngestionConfig ingestion = config.getIngestion();
        AppConfig.RetrievalConfig retrieval = config.getRetrieval();
        CapabilityInvoker invoker = new CapabilityInvoker(
                Duration.ofMillis(capabilities.getTimeoutMs()),
                capabilities.getMaxRetries(),
                capabilities.getRetryBackoffMs());

        ImageNormalizer imageNormalizer = new ImageNormalizer(captioning, invoker);
        IngestionPipeline pipeline = new IngestionPipeline(
                List.of(
                        new TextNormalizer(),
                        imageNormalizer,
                        new PdfNormalizer(imageNormalizer, ingestion.getPdfMinTextChars(), ingestion.getPdfRenderDpi())),
                new Chunker(config.getChunking().getMaxChunkSize(), config.getChunking().getOverlap()),
                embedding,
                store,
                invoker,
                ingestion.getMaxWorkers(),
                ingestion.getEmbeddingBatchSize());

        SemanticRetriever semantic = new SemanticRetriever(embedding, store, invoker);
        RetrievalEngine engine = new RetrievalEngine(
                List.of(
                        semantic,
                        new HybridRetriever(semantic, store, invoker, retrieval.getSemanticWeight(), retrieval.getLexicalWeight()),
                        new ExpandedRetriever(semantic, embedding, invoker, completion, retrieval.getExpansionVariants())),
                new QueryClassifier(retrieval.getShortQueryMaxWords()),
                new Reranker(config.getRerank()),
                cache,
                store,
                invoker,
                retrieval.getMaxResults());

        return new MultimodalRagService(
                store,
                cache,
                new DocumentLoader(ingestion.getMaxDocumentBytes()),
                pipeline,
                engine,
                new AnswerService(engine, completion, invoker),
                invoker);
    }

    public IngestionResult ingestOne(Document document) {
        return pipeline.ingestOne(document);
    }

    public BatchIngestionReport ingestMany(List<Document> documents, boolean parallel) {
        return pipeline.ingestMany(documents, parallel);
    }

    /**
     * Loads and ingests files. A file that cannot be loaded is reported as failed in its
     * position without stopping the rest of the batch.
     */
    public BatchIngestionReport ingestFiles(List<Path> files, boolean parallel) {
        List<Document> loaded = new ArrayList<>();
        List<IngestionResult> slots = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                loaded.add(loader.load(file));
                slots.add(null);
            } catch (ValidationException | IOException e) {
                log.warn("ingest.file.rejected path={} reason={}", file, e.getMessage());
                slots.add(IngestionResult.failed(null, String.valueOf(file.getFileName()), e.getMessage()));
            }
        }

        List<IngestionResult> ingested = pipeline.ingestMany(loaded, parallel).results();
        List<IngestionResult> results = new ArrayList<>(files.size());
        int next = 0;
        for (IngestionResult slot : slots) {
            results.add(slot != null ? slot : ingested.get(next++));
        }
        return new BatchIngestionReport(results);
    }

    public RetrievalResult retrieve(RetrievalRequest request) {
        return engine.retrieve(request);
    }

    public QueryIntent classify(String query) {
        return engine.classify(query);
    }

    public Answer answer(String query, int nResults) {
        return answerService.answer(query, nResults);
    }

    public int deleteDocument(String documentId) {
        return pipeline.deleteDocument(documentId);
    }

    public void clearCache() {
        cache.invalidateAll();
    }

    public StoreStats stats() {
        return new StoreStats(store.documentCount(), store.count(), cache.size());
    }

    @Override
    public void close() {
        invoker.close();
    }
}
