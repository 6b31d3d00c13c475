package com.mmrag.service;

public record StoreStats(int documentCount, int chunkCount, int cachedQueries) {
}
