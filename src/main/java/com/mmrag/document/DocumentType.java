package com.mmrag.document;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public enum DocumentType {
    TEXT,
    IMAGE,
    PDF;

    private static final Map<String, DocumentType> BY_EXTENSION = Map.of(
            "txt", TEXT,
            "text", TEXT,
            "md", TEXT,
            "markdown", TEXT,
            "pdf", PDF,
            "png", IMAGE,
            "jpg", IMAGE,
            "jpeg", IMAGE,
            "gif", IMAGE,
            "bmp", IMAGE);

    public static Optional<DocumentType> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_EXTENSION.get(fileName.substring(dot + 1).toLowerCase(Locale.ROOT)));
    }
}
