package com.mmrag.document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.mmrag.error.ValidationException;

public class DocumentLoader {
    private final long maxDocumentBytes;
    private final Clock clock;

    public DocumentLoader(long maxDocumentBytes) {
        this(maxDocumentBytes, Clock.systemUTC());
    }

    public DocumentLoader(long maxDocumentBytes, Clock clock) {
        this.maxDocumentBytes = maxDocumentBytes;
        this.clock = clock;
    }

    public Document load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new ValidationException("File does not exist: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new ValidationException("Path is not a file: " + path);
        }
        String fileName = path.getFileName().toString();
        DocumentType type = DocumentType.fromFileName(fileName)
                .orElseThrow(() -> new ValidationException("Unsupported file type: " + fileName));
        long size = Files.size(path);
        if (size > maxDocumentBytes) {
            throw new ValidationException("File size (%d bytes) exceeds maximum allowed (%d bytes): %s"
                    .formatted(size, maxDocumentBytes, fileName));
        }

        byte[] content = Files.readAllBytes(path);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("file_name", fileName);
        metadata.put("file_size", size);
        metadata.put("mime_type", mimeType(path, type));
        metadata.put("file_hash", fingerprint(content));
        return new Document(UUID.randomUUID().toString(), fileName, type, content, clock.instant(), metadata);
    }

    public static String fingerprint(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static String mimeType(Path path, DocumentType type) throws IOException {
        String probed = Files.probeContentType(path);
        if (probed != null) {
            return probed;
        }
        return switch (type) {
            case TEXT -> "text/plain";
            case PDF -> "application/pdf";
            case IMAGE -> "application/octet-stream";
        };
    }
}
