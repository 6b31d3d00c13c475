package com.mmrag.store;

import com.mmrag.document.Chunk;

public record StoreMatch(Chunk chunk, double score) {
}
