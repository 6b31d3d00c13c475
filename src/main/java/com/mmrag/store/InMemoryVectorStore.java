package com.mmrag.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mmrag.document.Chunk;

public class InMemoryVectorStore implements VectorStore {
    static final Comparator<StoreMatch> RANKING = Comparator.comparingDouble(StoreMatch::score).reversed()
            .thenComparing(match -> match.chunk().id());

    private final Map<String, StoredChunk> chunks = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String put(Chunk chunk, float[] embedding) {
        chunks.put(chunk.id(), new StoredChunk(chunk, embedding.clone()));
        return chunk.id();
    }

    @Override
    public List<StoreMatch> query(float[] embedding, int k, Map<String, Object> filter) {
        return chunks.values().stream()
                .filter(stored -> matches(stored.chunk(), filter))
                .map(stored -> new StoreMatch(stored.chunk(), cosine(embedding, stored.embedding())))
                .sorted(RANKING)
                .limit(k)
                .toList();
    }

    @Override
    public List<StoreMatch> keywordQuery(Set<String> terms, int k, Map<String, Object> filter) {
        return chunks.values().stream()
                .filter(stored -> matches(stored.chunk(), filter))
                .map(stored -> new StoreMatch(stored.chunk(), TermOverlap.score(terms, stored.chunk().text())))
                .filter(match -> match.score() > 0)
                .sorted(RANKING)
                .limit(k)
                .toList();
    }

    @Override
    public int delete(String documentId) {
        List<String> toRemove = chunks.values().stream()
                .filter(stored -> stored.chunk().documentId().equals(documentId))
                .map(stored -> stored.chunk().id())
                .toList();
        toRemove.forEach(chunks::remove);
        return toRemove.size();
    }

    @Override
    public int count() {
        return chunks.size();
    }

    @Override
    public int documentCount() {
        return (int) chunks.values().stream()
                .map(stored -> stored.chunk().documentId())
                .distinct()
                .count();
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        List<StoredChunk> snapshot = chunks.values().stream()
                .sorted(Comparator.comparing(stored -> stored.chunk().id()))
                .toList();
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), snapshot);
    }

    public static InMemoryVectorStore load(Path path) throws IOException {
        InMemoryVectorStore store = new InMemoryVectorStore();
        if (!Files.exists(path)) {
            return store;
        }
        List<StoredChunk> loaded = store.objectMapper.readValue(path.toFile(), new TypeReference<List<StoredChunk>>() {
        });
        for (StoredChunk entry : loaded) {
            store.chunks.put(entry.chunk().id(), entry);
        }
        return store;
    }

    static boolean matches(Chunk chunk, Map<String, Object> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> condition : filter.entrySet()) {
            Object actual = chunk.attribute(condition.getKey());
            Object expected = condition.getValue();
            if (actual == null || expected == null) {
                return false;
            }
            if (actual instanceof Number a && expected instanceof Number e) {
                if (Double.compare(a.doubleValue(), e.doubleValue()) != 0) {
                    return false;
                }
            } else if (!String.valueOf(actual).equals(String.valueOf(expected))) {
                return false;
            }
        }
        return true;
    }

    private static double cosine(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        double dot = 0;
        double aNorm = 0;
        double bNorm = 0;
        for (int i = 0; i < len; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0 || bNorm == 0) {
            return 0;
        }
        return dot / Math.sqrt(aNorm * bNorm);
    }

    public record StoredChunk(Chunk chunk, float[] embedding) {
    }
}
