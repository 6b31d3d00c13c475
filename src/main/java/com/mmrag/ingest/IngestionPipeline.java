package com.mmrag.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mmrag.capability.CapabilityInvoker;
import com.mmrag.capability.EmbeddingService;
import com.mmrag.chunk.Chunker;
import com.mmrag.chunk.TextSpan;
import com.mmrag.document.Chunk;
import com.mmrag.document.Document;
import com.mmrag.error.CapabilityUnavailableException;
import com.mmrag.error.ValidationException;
import com.mmrag.normalize.ModalityNormalizer;
import com.mmrag.normalize.NormalizedUnit;
import com.mmrag.store.VectorStore;

/**
 * Turns documents into stored chunks: normalize, chunk, embed in batches, then write.
 * Each document succeeds or fails on its own; a failed document leaves no chunks behind.
 */
public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);
    private static final AtomicInteger WORKER_COUNTER = new AtomicInteger();

    private final List<ModalityNormalizer> normalizers;
    private final Chunker chunker;
    private final EmbeddingService embeddingService;
    private final VectorStore store;
    private final CapabilityInvoker invoker;
    private final int maxWorkers;
    private final int embeddingBatchSize;
    private final List<Runnable> invalidationListeners = new CopyOnWriteArrayList<>();

    public IngestionPipeline(
            List<ModalityNormalizer> normalizers,
            Chunker chunker,
            EmbeddingService embeddingService,
            VectorStore store,
            CapabilityInvoker invoker,
            int maxWorkers,
            int embeddingBatchSize) {
        if (maxWorkers < 1) {
            throw new ValidationException("maxWorkers must be at least 1");
        }
        if (embeddingBatchSize < 1) {
            throw new ValidationException("embeddingBatchSize must be at least 1");
        }
        this.normalizers = List.copyOf(normalizers);
        this.chunker = chunker;
        this.embeddingService = embeddingService;
        this.store = store;
        this.invoker = invoker;
        this.maxWorkers = maxWorkers;
        this.embeddingBatchSize = embeddingBatchSize;
    }

    public void addInvalidationListener(Runnable listener) {
        invalidationListeners.add(listener);
    }

    public IngestionResult ingestOne(Document document) {
        try {
            int created = store(document);
            notifyInvalidation();
            log.info("ingest.document.completed documentId={} source={} chunks={}",
                    document.id(), document.sourceName(), created);
            return IngestionResult.succeeded(document.id(), document.sourceName(), created);
        } catch (ValidationException | CapabilityUnavailableException e) {
            log.warn("ingest.document.failed documentId={} source={} reason={}",
                    document.id(), document.sourceName(), e.getMessage());
            return IngestionResult.failed(document.id(), document.sourceName(), e.getMessage());
        } catch (IOException | RuntimeException e) {
            log.error("ingest.document.failed documentId={} source={} reason={}",
                    document.id(), document.sourceName(), e.toString(), e);
            return IngestionResult.failed(document.id(), document.sourceName(), e.toString());
        }
    }

    public BatchIngestionReport ingestMany(List<Document> documents, boolean parallel) {
        if (documents.isEmpty()) {
            return new BatchIngestionReport(List.of());
        }
        if (!parallel || documents.size() == 1) {
            return new BatchIngestionReport(documents.stream().map(this::ingestOne).toList());
        }

        int workers = Math.min(maxWorkers, documents.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "ingest-worker-" + WORKER_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("ingest.batch.started documents={} workers={}", documents.size(), workers);
        try {
            List<Callable<IngestionResult>> tasks = documents.stream()
                    .<Callable<IngestionResult>>map(document -> () -> ingestOne(document))
                    .toList();
            List<Future<IngestionResult>> futures = pool.invokeAll(tasks);
            List<IngestionResult> results = new ArrayList<>(documents.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), documents.get(i)));
            }
            return new BatchIngestionReport(results);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while ingesting documents", e);
        } finally {
            pool.shutdownNow();
        }
    }

    public int deleteDocument(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw new ValidationException("documentId must not be blank");
        }
        int removed = invoker.write("vector-store", () -> store.delete(documentId));
        if (removed > 0) {
            notifyInvalidation();
        }
        log.info("ingest.document.deleted documentId={} chunks={}", documentId, removed);
        return removed;
    }

    private int store(Document document) throws IOException {
        ModalityNormalizer normalizer = normalizers.stream()
                .filter(candidate -> candidate.supports(document.type()))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unsupported document type: " + document.type()));

        List<Chunk> chunks = toChunks(document, normalizer.normalize(document));
        if (chunks.isEmpty()) {
            throw new ValidationException("Document has no extractable content: " + document.sourceName());
        }
        List<float[]> embeddings = embed(chunks);

        int written = 0;
        try {
            for (int i = 0; i < chunks.size(); i++) {
                Chunk chunk = chunks.get(i);
                float[] embedding = embeddings.get(i);
                invoker.write("vector-store", () -> store.put(chunk, embedding));
                written++;
            }
        } catch (RuntimeException e) {
            rollback(document, e);
            if (written > 0) {
                notifyInvalidation();
            }
            throw e;
        }
        return written;
    }

    private List<Chunk> toChunks(Document document, List<NormalizedUnit> units) {
        List<Chunk> chunks = new ArrayList<>();
        int position = 0;
        for (NormalizedUnit unit : units) {
            if (unit.text() == null || unit.text().isBlank()) {
                continue;
            }
            for (TextSpan span : chunker.chunk(unit.text())) {
                Map<String, Object> metadata = new LinkedHashMap<>(document.metadata());
                metadata.putAll(unit.metadata());
                metadata.put(Chunk.UPLOADED_AT, document.uploadedAt().toString());
                chunks.add(new Chunk(
                        Chunk.idFor(document.id(), position),
                        document.id(),
                        document.sourceName(),
                        unit.modality(),
                        position,
                        span.start(),
                        span.end(),
                        span.text(),
                        metadata));
                position++;
            }
        }
        return chunks;
    }

    private List<float[]> embed(List<Chunk> chunks) {
        List<float[]> embeddings = new ArrayList<>(chunks.size());
        for (int from = 0; from < chunks.size(); from += embeddingBatchSize) {
            List<String> texts = chunks.subList(from, Math.min(from + embeddingBatchSize, chunks.size())).stream()
                    .map(Chunk::text)
                    .toList();
            List<float[]> batch = invoker.read("embedding", () -> embeddingService.embedBatch(texts));
            if (batch.size() != texts.size()) {
                throw new CapabilityUnavailableException("embedding",
                        "expected " + texts.size() + " embeddings but received " + batch.size());
            }
            embeddings.addAll(batch);
        }
        return embeddings;
    }

    private void rollback(Document document, RuntimeException cause) {
        try {
            int removed = store.delete(document.id());
            log.warn("ingest.document.rolled_back documentId={} chunks={} reason={}",
                    document.id(), removed, cause.getMessage());
        } catch (RuntimeException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            log.error("ingest.document.rollback_failed documentId={}", document.id(), rollbackFailure);
        }
    }

    private IngestionResult await(Future<IngestionResult> future, Document document) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("ingest.document.failed documentId={} source={} reason={}",
                    document.id(), document.sourceName(), cause.toString(), cause);
            return IngestionResult.failed(document.id(), document.sourceName(), cause.toString());
        }
    }

    private void notifyInvalidation() {
        for (Runnable listener : invalidationListeners) {
            listener.run();
        }
    }
}
