package com.mmrag.normalize;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.imageio.ImageIO;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mmrag.document.Chunk;
import com.mmrag.document.Document;
import com.mmrag.document.DocumentType;
import com.mmrag.document.Modality;
import com.mmrag.error.ValidationException;

public class PdfNormalizer implements ModalityNormalizer {
    private static final Logger log = LoggerFactory.getLogger(PdfNormalizer.class);
    public static final String PDF_LAYOUT = "pdf_layout";
    public static final String PAGE_COUNT = "page_count";

    private final ImageNormalizer imageNormalizer;
    private final int minTextChars;
    private final float renderDpi;

    public PdfNormalizer(ImageNormalizer imageNormalizer, int minTextChars, float renderDpi) {
        this.imageNormalizer = imageNormalizer;
        this.minTextChars = minTextChars;
        this.renderDpi = renderDpi;
    }

    @Override
    public boolean supports(DocumentType type) {
        return type == DocumentType.PDF;
    }

    @Override
    public List<NormalizedUnit> normalize(Document document) throws IOException {
        try (PDDocument pdf = open(document)) {
            int pageCount = pdf.getNumberOfPages();
            if (pageCount == 0) {
                throw new ValidationException("PDF has no pages: " + document.sourceName());
            }

            List<String> pageTexts = extractPageTexts(pdf);
            List<Boolean> textPages = pageTexts.stream()
                    .map(this::isTextPage)
                    .toList();
            PdfLayout layout = PdfLayout.classify(textPages);
            log.info("normalize.pdf source={} pages={} layout={}", document.sourceName(), pageCount, layout.label());

            Map<String, Object> documentMetadata = documentMetadata(pdf, pageCount, layout);
            PDFRenderer renderer = new PDFRenderer(pdf);
            List<NormalizedUnit> units = new ArrayList<>(pageCount);
            for (int pageIndex = 0; pageIndex < pageCount; pageIndex++) {
                Map<String, Object> pageMetadata = new LinkedHashMap<>(documentMetadata);
                pageMetadata.put(Chunk.PAGE, pageIndex + 1);
                if (textPages.get(pageIndex)) {
                    units.add(new NormalizedUnit(TextNormalizer.clean(pageTexts.get(pageIndex)), Modality.PDF_TEXT, pageMetadata));
                } else {
                    byte[] raster = rasterize(renderer, pageIndex);
                    String pageName = "%s#page-%d".formatted(document.sourceName(), pageIndex + 1);
                    units.add(imageNormalizer.describe(raster, pageName, Modality.PDF_IMAGE, pageMetadata));
                }
            }
            return units;
        }
    }

    private static PDDocument open(Document document) {
        try {
            return Loader.loadPDF(document.content());
        } catch (IOException e) {
            throw new ValidationException("Unreadable PDF: " + document.sourceName(), e);
        }
    }

    private static List<String> extractPageTexts(PDDocument pdf) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        List<String> texts = new ArrayList<>(pdf.getNumberOfPages());
        for (int page = 1; page <= pdf.getNumberOfPages(); page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            texts.add(stripper.getText(pdf));
        }
        return texts;
    }

    private boolean isTextPage(String pageText) {
        long visible = pageText.chars().filter(ch -> !Character.isWhitespace(ch)).count();
        return visible >= minTextChars;
    }

    private byte[] rasterize(PDFRenderer renderer, int pageIndex) throws IOException {
        BufferedImage image = renderer.renderImageWithDPI(pageIndex, renderDpi, ImageType.RGB);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    private static Map<String, Object> documentMetadata(PDDocument pdf, int pageCount, PdfLayout layout) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(PAGE_COUNT, pageCount);
        metadata.put(PDF_LAYOUT, layout.label());
        PDDocumentInformation info = pdf.getDocumentInformation();
        if (info != null) {
            if (info.getTitle() != null && !info.getTitle().isBlank()) {
                metadata.put("title", info.getTitle());
            }
            if (info.getAuthor() != null && !info.getAuthor().isBlank()) {
                metadata.put("author", info.getAuthor());
            }
        }
        return metadata;
    }
}
