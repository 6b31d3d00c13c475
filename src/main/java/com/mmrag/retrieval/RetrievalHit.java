package com.mmrag.retrieval;

import com.mmrag.document.Chunk;

public record RetrievalHit(Chunk chunk, double score) {
}
