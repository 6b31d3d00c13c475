package com.mmrag.document;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record Document(
        String id,
        String sourceName,
        DocumentType type,
        byte[] content,
        Instant uploadedAt,
        Map<String, Object> metadata) {

    public Document {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static Document of(String sourceName, DocumentType type, byte[] content) {
        return new Document(UUID.randomUUID().toString(), sourceName, type, content, Instant.now(), Map.of());
    }

    public int size() {
        return content == null ? 0 : content.length;
    }
}
