package com.mmrag.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Color;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mmrag.TestFiles;
import com.mmrag.cache.ResultCache;
import com.mmrag.capability.LocalImageDescriptionService;
import com.mmrag.capability.LocalModelEmbeddingService;
import com.mmrag.document.Chunk;
import com.mmrag.document.Document;
import com.mmrag.document.DocumentType;
import com.mmrag.error.NoDataException;
import com.mmrag.error.ValidationException;
import com.mmrag.ingest.BatchIngestionReport;
import com.mmrag.ingest.IngestionResult;
import com.mmrag.query.QueryIntent;
import com.mmrag.retrieval.RetrievalRequest;
import com.mmrag.retrieval.RetrievalResult;
import com.mmrag.retrieval.RetrievalStrategy;
import com.mmrag.runtime.AppConfig;
import com.mmrag.store.InMemoryVectorStore;

class MultimodalRagServiceTest {

    @TempDir
    Path tempDir;

    private final InMemoryVectorStore store = new InMemoryVectorStore();
    private final ResultCache cache = new ResultCache(true, Duration.ofHours(1));
    private MultimodalRagService service;

    @BeforeEach
    void createService() {
        service = MultimodalRagService.create(new AppConfig(), store, cache,
                new LocalModelEmbeddingService(384), new LocalImageDescriptionService(), Optional.empty());
    }

    @AfterEach
    void closeService() {
        service.close();
    }

    @Test
    void shouldIngestMixedBatchAndReportRejectedFilesInPosition() throws Exception {
        Path notes = Files.writeString(tempDir.resolve("notes.txt"), "Solar panels convert sunlight into electricity.");
        Path csv = Files.writeString(tempDir.resolve("data.csv"), "a,b,c");
        Path chart = Files.write(tempDir.resolve("chart.png"), TestFiles.png(40, 20, Color.BLUE));
        Path report = Files.write(tempDir.resolve("report.pdf"),
                TestFiles.pdf(List.of("Quarterly wind turbine maintenance report for the northern farm.")));

        BatchIngestionReport batch = service.ingestFiles(List.of(notes, csv, chart, report), true);

        List<IngestionResult> results = batch.results();
        assertEquals(4, results.size());
        assertEquals(List.of("notes.txt", "data.csv", "chart.png", "report.pdf"),
                results.stream().map(IngestionResult::sourceName).toList());
        assertFalse(results.get(1).success());
        assertNull(results.get(1).documentId());
        assertTrue(results.get(1).error().contains("Unsupported file type"));
        assertTrue(results.get(0).success() && results.get(2).success() && results.get(3).success());
        assertTrue(batch.partialFailure());
        assertEquals(3, batch.successes());

        StoreStats stats = service.stats();
        assertEquals(3, stats.documentCount());
        assertEquals(batch.chunksCreated(), stats.chunkCount());
    }

    @Test
    void shouldInvalidateCachedResultsWhenStoreChanges() {
        IngestionResult solar = service.ingestOne(text("solar.txt", "Solar panels convert sunlight into electricity."));
        service.ingestOne(text("wind.txt", "Wind turbines need a quarterly gearbox inspection."));
        RetrievalRequest request = new RetrievalRequest("solar panels", 2, RetrievalStrategy.SEMANTIC, Map.of(), false);

        RetrievalResult before = service.retrieve(request);
        assertEquals(1, service.stats().cachedQueries());

        service.ingestOne(text("grid.txt", "Grid batteries store surplus solar energy."));
        assertEquals(0, service.stats().cachedQueries());

        RetrievalResult after = service.retrieve(request);
        assertEquals(2, after.hits().size());
        assertEquals(solar.documentId(), before.hits().get(0).chunk().documentId());

        int removed = service.deleteDocument(solar.documentId());
        assertEquals(1, removed);
        assertEquals(0, service.stats().cachedQueries());
        assertTrue(service.retrieve(request).hits().stream()
                .noneMatch(hit -> hit.chunk().documentId().equals(solar.documentId())));
    }

    @Test
    void shouldDropResultsCachedDuringIngestionThatRollsBack() {
        AtomicReference<MultimodalRagService> current = new AtomicReference<>();
        AtomicReference<RetrievalResult> midIngestion = new AtomicReference<>();
        RetrievalRequest request = new RetrievalRequest("solar panels", 1, RetrievalStrategy.SEMANTIC, Map.of(), false);
        InMemoryVectorStore interrupted = new InMemoryVectorStore() {
            @Override
            public String put(Chunk chunk, float[] embedding) {
                if (chunk.position() == 1) {
                    midIngestion.set(current.get().retrieve(request));
                    throw new IllegalStateException("disk full");
                }
                return super.put(chunk, embedding);
            }
        };
        AppConfig config = new AppConfig();
        config.getChunking().setMaxChunkSize(60);
        config.getChunking().setOverlap(10);
        ResultCache sharedCache = new ResultCache(true, Duration.ofHours(1));
        try (MultimodalRagService rolledBack = MultimodalRagService.create(config, interrupted, sharedCache,
                new LocalModelEmbeddingService(384), new LocalImageDescriptionService(), Optional.empty())) {
            current.set(rolledBack);

            IngestionResult result = rolledBack.ingestOne(text("solar.txt",
                    "Solar panels convert sunlight into electricity. Inverters feed the grid every day."));

            assertFalse(result.success());
            assertEquals(1, midIngestion.get().hits().size());
            assertEquals(0, interrupted.count());
            assertEquals(0, rolledBack.stats().cachedQueries());
            assertThrows(NoDataException.class, () -> rolledBack.retrieve(request));
        }
    }

    @Test
    void shouldKeepCacheWhenDeletingUnknownDocument() {
        service.ingestOne(text("solar.txt", "Solar panels convert sunlight into electricity."));
        service.retrieve(RetrievalRequest.of("What is solar power?", 1));

        assertEquals(0, service.deleteDocument("no-such-document"));
        assertEquals(1, service.stats().cachedQueries());
        assertThrows(ValidationException.class, () -> service.deleteDocument(" "));

        service.clearCache();
        assertEquals(0, service.stats().cachedQueries());
    }

    @Test
    void shouldAnswerAndClassifyThroughFacade() {
        service.ingestOne(text("wind.txt", "Wind turbines need a quarterly gearbox inspection."));

        assertEquals(QueryIntent.CROSS_MODAL, service.classify("show me the chart of turbine output"));
        assertTrue(service.answer("When is the gearbox inspection?", 1).text()
                .startsWith("[wind.txt] Wind turbines need a quarterly gearbox inspection."));
    }

    @Test
    void shouldTagChunksWithSourceAndModality() {
        service.ingestOne(text("solar.txt", "Solar panels convert sunlight into electricity."));

        RetrievalResult result = service.retrieve(RetrievalRequest.of("What is solar power?", 1));

        Chunk chunk = result.hits().get(0).chunk();
        assertEquals("solar.txt", chunk.attribute(Chunk.SOURCE));
        assertEquals("text", chunk.attribute(Chunk.MODALITY));
        assertTrue(chunk.metadata().containsKey(Chunk.UPLOADED_AT));
    }

    private static Document text(String name, String body) {
        return Document.of(name, DocumentType.TEXT, body.getBytes(StandardCharsets.UTF_8));
    }
}
