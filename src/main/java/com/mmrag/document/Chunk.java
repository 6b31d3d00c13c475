package com.mmrag.document;

import java.util.Map;

public record Chunk(
        String id,
        String documentId,
        String sourceName,
        Modality modality,
        int position,
        int spanStart,
        int spanEnd,
        String text,
        Map<String, Object> metadata) {

    public static final String DOCUMENT_ID = "document_id";
    public static final String SOURCE = "source";
    public static final String MODALITY = "modality";
    public static final String POSITION = "position";
    public static final String UPLOADED_AT = "uploaded_at";
    public static final String PAGE = "page";

    public Chunk {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static String idFor(String documentId, int position) {
        return documentId + "#" + position;
    }

    public Object attribute(String key) {
        return switch (key) {
            case DOCUMENT_ID -> documentId;
            case SOURCE -> sourceName;
            case MODALITY -> modality.label();
            case POSITION -> position;
            default -> metadata.get(key);
        };
    }
}
