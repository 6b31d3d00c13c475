package com.mmrag.normalize;

import java.util.Map;

import com.mmrag.document.Modality;

public record NormalizedUnit(String text, Modality modality, Map<String, Object> metadata) {
    public NormalizedUnit {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
