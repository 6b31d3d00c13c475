package com.mmrag.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mmrag.document.Chunk;
import com.mmrag.document.Modality;

class InMemoryVectorStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldRankByCosineSimilarityAndBreakTiesById() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        store.put(chunk("b", 0, "beta", Map.of()), new float[] { 1, 0 });
        store.put(chunk("a", 0, "alpha", Map.of()), new float[] { 1, 0 });
        store.put(chunk("c", 0, "gamma", Map.of()), new float[] { 0, 1 });

        List<StoreMatch> matches = store.query(new float[] { 1, 0 }, 2, Map.of());

        assertEquals(List.of("a#0", "b#0"), matches.stream().map(match -> match.chunk().id()).toList());
        assertEquals(1.0, matches.get(0).score(), 1e-9);
    }

    @Test
    void shouldFilterOnChunkFieldsAndMetadata() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        store.put(chunk("doc", 0, "first page", Map.of(Chunk.PAGE, 1)), new float[] { 1, 0 });
        store.put(chunk("doc", 1, "second page", Map.of(Chunk.PAGE, 2)), new float[] { 1, 0 });
        store.put(chunk("other", 0, "other doc", Map.of(Chunk.PAGE, 2)), new float[] { 1, 0 });

        assertEquals(2, store.query(new float[] { 1, 0 }, 10, Map.of(Chunk.DOCUMENT_ID, "doc")).size());
        assertEquals(2, store.query(new float[] { 1, 0 }, 10, Map.of(Chunk.PAGE, "2")).size());
        assertEquals(1, store.query(new float[] { 1, 0 }, 10, Map.of(Chunk.PAGE, 2L, Chunk.SOURCE, "doc.txt")).size());
        assertEquals(3, store.query(new float[] { 1, 0 }, 10, Map.of(Chunk.MODALITY, "text")).size());
        assertEquals(0, store.query(new float[] { 1, 0 }, 10, Map.of("missing", "x")).size());
    }

    @Test
    void shouldScoreKeywordMatchesByTermOverlap() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        store.put(chunk("a", 0, "Wind turbines need maintenance.", Map.of()), new float[] { 1 });
        store.put(chunk("b", 0, "Turbines spin in the wind and the rain.", Map.of()), new float[] { 1 });
        store.put(chunk("c", 0, "Bread recipes.", Map.of()), new float[] { 1 });

        List<StoreMatch> matches = store.keywordQuery(Set.of("wind", "turbines", "maintenance"), 5, Map.of());

        assertEquals(List.of("a#0", "b#0"), matches.stream().map(match -> match.chunk().id()).toList());
        assertEquals(1.0, matches.get(0).score(), 1e-9);
        assertEquals(2.0 / 3.0, matches.get(1).score(), 1e-9);
    }

    @Test
    void shouldDeleteAllChunksOfDocument() {
        InMemoryVectorStore store = new InMemoryVectorStore();
        store.put(chunk("doc", 0, "one", Map.of()), new float[] { 1 });
        store.put(chunk("doc", 1, "two", Map.of()), new float[] { 1 });
        store.put(chunk("keep", 0, "three", Map.of()), new float[] { 1 });

        assertEquals(2, store.delete("doc"));
        assertEquals(1, store.count());
        assertEquals(1, store.documentCount());
        assertEquals(0, store.delete("doc"));
    }

    @Test
    void shouldRoundTripSnapshot() throws Exception {
        InMemoryVectorStore store = new InMemoryVectorStore();
        store.put(chunk("doc", 0, "persisted text", Map.of(Chunk.PAGE, 4, Chunk.UPLOADED_AT, "2024-01-01T00:00:00Z")),
                new float[] { 0.6f, 0.8f });
        Path snapshot = tempDir.resolve("store/vector-store.json");

        store.save(snapshot);
        InMemoryVectorStore reloaded = InMemoryVectorStore.load(snapshot);

        assertEquals(1, reloaded.count());
        StoreMatch match = reloaded.query(new float[] { 0.6f, 0.8f }, 1, Map.of(Chunk.PAGE, 4)).get(0);
        assertEquals(store.query(new float[] { 0.6f, 0.8f }, 1, Map.of()).get(0).chunk(), match.chunk());
        assertEquals(1.0, match.score(), 1e-6);
        assertTrue(InMemoryVectorStore.load(tempDir.resolve("absent.json")).count() == 0);
    }

    private static Chunk chunk(String documentId, int position, String text, Map<String, Object> metadata) {
        return new Chunk(Chunk.idFor(documentId, position), documentId, documentId + ".txt", Modality.TEXT, position, 0,
                text.length(), text, metadata);
    }
}
