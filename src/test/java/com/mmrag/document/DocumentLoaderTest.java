package com.mmrag.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mmrag.error.ValidationException;

class DocumentLoaderTest {

    private static final Instant NOW = Instant.parse("2024-03-04T05:06:07Z");

    @TempDir
    Path tempDir;

    private final DocumentLoader loader = new DocumentLoader(1_000, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void shouldLoadDocumentWithFileMetadata() throws Exception {
        Path file = Files.writeString(tempDir.resolve("Notes.MD"), "# Heading\nbody");

        Document document = loader.load(file);

        assertEquals(DocumentType.TEXT, document.type());
        assertEquals("Notes.MD", document.sourceName());
        assertEquals(NOW, document.uploadedAt());
        assertEquals(14, document.size());
        assertEquals("Notes.MD", document.metadata().get("file_name"));
        assertEquals(14L, document.metadata().get("file_size"));
        assertEquals(DocumentLoader.fingerprint(Files.readAllBytes(file)), document.metadata().get("file_hash"));
        assertTrue(document.metadata().containsKey("mime_type"));
    }

    @Test
    void shouldRejectUnsupportedMissingAndOversizeFiles() throws Exception {
        Path unsupported = Files.writeString(tempDir.resolve("data.csv"), "a,b");
        Path oversize = Files.write(tempDir.resolve("huge.txt"), new byte[1_001]);

        assertThrows(ValidationException.class, () -> loader.load(unsupported));
        assertThrows(ValidationException.class, () -> loader.load(tempDir.resolve("missing.pdf")));
        assertThrows(ValidationException.class, () -> loader.load(tempDir));
        ValidationException error = assertThrows(ValidationException.class, () -> loader.load(oversize));
        assertTrue(error.getMessage().contains("exceeds maximum allowed"));
    }

    @Test
    void shouldDetectTypesFromExtension() {
        assertEquals(DocumentType.PDF, DocumentType.fromFileName("report.PDF").orElseThrow());
        assertEquals(DocumentType.IMAGE, DocumentType.fromFileName("photo.jpeg").orElseThrow());
        assertTrue(DocumentType.fromFileName("README").isEmpty());
        assertTrue(DocumentType.fromFileName("archive.").isEmpty());
    }
}
