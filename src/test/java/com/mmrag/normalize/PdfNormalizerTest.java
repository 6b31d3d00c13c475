package com.mmrag.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.mmrag.TestFiles;
import com.mmrag.capability.CapabilityInvoker;
import com.mmrag.document.Chunk;
import com.mmrag.document.Document;
import com.mmrag.document.DocumentType;
import com.mmrag.document.Modality;
import com.mmrag.error.ValidationException;

class PdfNormalizerTest {

    private final CapabilityInvoker invoker = new CapabilityInvoker(Duration.ofSeconds(30), 0, 0);
    private final List<String> captionedPages = new ArrayList<>();
    private final PdfNormalizer normalizer = new PdfNormalizer(
            new ImageNormalizer((image, name) -> {
                synchronized (captionedPages) {
                    captionedPages.add(name);
                }
                return "A scanned diagram of the ingestion flow";
            }, invoker),
            20,
            72f);

    @AfterEach
    void closeInvoker() {
        invoker.close();
    }

    @Test
    void shouldExtractTextPagesOfTextOnlyPdf() throws Exception {
        Document document = Document.of("report.pdf", DocumentType.PDF, TestFiles.pdf(List.of(
                "Quarterly revenue grew by twelve percent across all regions.",
                "Operating costs remained flat compared with the previous year.")));

        List<NormalizedUnit> units = normalizer.normalize(document);

        assertEquals(2, units.size());
        assertTrue(units.stream().allMatch(unit -> unit.modality() == Modality.PDF_TEXT));
        assertTrue(units.get(0).text().contains("Quarterly revenue grew"));
        assertEquals(1, units.get(0).metadata().get(Chunk.PAGE));
        assertEquals(2, units.get(1).metadata().get(Chunk.PAGE));
        assertEquals("text_only", units.get(0).metadata().get(PdfNormalizer.PDF_LAYOUT));
        assertEquals(2, units.get(0).metadata().get(PdfNormalizer.PAGE_COUNT));
        assertEquals("Test Report", units.get(0).metadata().get("title"));
        assertTrue(captionedPages.isEmpty());
    }

    @Test
    void shouldRenderAndCaptionPagesWithoutText() throws Exception {
        Document document = Document.of("scan.pdf", DocumentType.PDF, TestFiles.pdf(Arrays.asList(null, null)));

        List<NormalizedUnit> units = normalizer.normalize(document);

        assertEquals(2, units.size());
        assertTrue(units.stream().allMatch(unit -> unit.modality() == Modality.PDF_IMAGE));
        assertEquals("image_only", units.get(0).metadata().get(PdfNormalizer.PDF_LAYOUT));
        assertEquals("A scanned diagram of the ingestion flow", units.get(1).text());
        assertEquals(List.of("scan.pdf#page-1", "scan.pdf#page-2"), captionedPages);
    }

    @Test
    void shouldKeepPageOrderForMixedPdf() throws Exception {
        Document document = Document.of("mixed.pdf", DocumentType.PDF, TestFiles.pdf(Arrays.asList(
                "Introduction to the multimodal retrieval system design.",
                null,
                "Conclusion with the final evaluation of retrieval quality.")));

        List<NormalizedUnit> units = normalizer.normalize(document);

        assertEquals(List.of(Modality.PDF_TEXT, Modality.PDF_IMAGE, Modality.PDF_TEXT),
                units.stream().map(NormalizedUnit::modality).toList());
        assertEquals(List.of(1, 2, 3), units.stream().map(unit -> unit.metadata().get(Chunk.PAGE)).toList());
        assertTrue(units.stream().allMatch(unit -> "mixed".equals(unit.metadata().get(PdfNormalizer.PDF_LAYOUT))));
    }

    @Test
    void shouldTreatPagesBelowTextThresholdAsImages() throws Exception {
        Document document = Document.of("sparse.pdf", DocumentType.PDF, TestFiles.pdf(List.of("Fig. 1")));

        List<NormalizedUnit> units = normalizer.normalize(document);

        assertEquals(Modality.PDF_IMAGE, units.get(0).modality());
    }

    @Test
    void shouldRejectCorruptPdf() {
        Document document = Document.of("corrupt.pdf", DocumentType.PDF, "not a pdf at all".getBytes());

        assertThrows(ValidationException.class, () -> normalizer.normalize(document));
    }
}
