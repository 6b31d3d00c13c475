package com.mmrag.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.mmrag.retrieval.RetrievalRequest;
import com.mmrag.retrieval.RetrievalStrategy;

class CacheKeyTest {

    @Test
    void shouldIgnoreFilterInsertionOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("source", "a.pdf");
        first.put("page", 2);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("page", 2);
        second.put("source", "a.pdf");

        String a = CacheKey.of(new RetrievalRequest("solar", 5, RetrievalStrategy.HYBRID, first, false));
        String b = CacheKey.of(new RetrievalRequest("solar", 5, RetrievalStrategy.HYBRID, second, false));

        assertEquals(a, b);
        assertEquals(64, a.length());
    }

    @Test
    void shouldRenderSortedCanonicalJson() {
        String json = CacheKey.canonicalJson(new RetrievalRequest("solar", 3, RetrievalStrategy.SEMANTIC,
                Map.of("source", "a.pdf"), true));

        assertEquals("{\"filter\":{\"source\":\"a.pdf\"},\"n_results\":3,\"query\":\"solar\",\"rerank\":true,\"strategy\":\"semantic\"}", json);
    }

    @Test
    void shouldDistinguishEveryKeyComponent() {
        RetrievalRequest base = new RetrievalRequest("solar", 5, RetrievalStrategy.SEMANTIC, Map.of(), false);

        assertNotEquals(CacheKey.of(base), CacheKey.of(new RetrievalRequest("wind", 5, RetrievalStrategy.SEMANTIC, Map.of(), false)));
        assertNotEquals(CacheKey.of(base), CacheKey.of(new RetrievalRequest("solar", 6, RetrievalStrategy.SEMANTIC, Map.of(), false)));
        assertNotEquals(CacheKey.of(base), CacheKey.of(new RetrievalRequest("solar", 5, RetrievalStrategy.HYBRID, Map.of(), false)));
        assertNotEquals(CacheKey.of(base), CacheKey.of(new RetrievalRequest("solar", 5, RetrievalStrategy.SEMANTIC, Map.of(), true)));
        assertNotEquals(CacheKey.of(base), CacheKey.of(new RetrievalRequest("solar", 5, RetrievalStrategy.SEMANTIC, Map.of("page", 1), false)));
    }

    @Test
    void shouldRequireResolvedStrategy() {
        assertThrows(IllegalStateException.class, () -> CacheKey.of(RetrievalRequest.of("solar", 5)));
    }
}
