package com.mmrag.ingest;

public record IngestionResult(String documentId, String sourceName, boolean success, int chunksCreated, String error) {

    public static IngestionResult succeeded(String documentId, String sourceName, int chunksCreated) {
        return new IngestionResult(documentId, sourceName, true, chunksCreated, null);
    }

    public static IngestionResult failed(String documentId, String sourceName, String error) {
        return new IngestionResult(documentId, sourceName, false, 0, error);
    }
}
