package com.mmrag.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mmrag.error.ValidationException;

public enum Modality {
    TEXT("text"),
    IMAGE("image"),
    PDF_TEXT("pdf-text"),
    PDF_IMAGE("pdf-image");

    private final String label;

    Modality(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static Modality fromLabel(String label) {
        for (Modality modality : values()) {
            if (modality.label.equalsIgnoreCase(label) || modality.name().equalsIgnoreCase(label)) {
                return modality;
            }
        }
        throw new ValidationException("Unknown modality: " + label);
    }
}
