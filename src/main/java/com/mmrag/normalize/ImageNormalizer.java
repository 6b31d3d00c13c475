package com.mmrag.normalize;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mmrag.capability.CapabilityInvoker;
import com.mmrag.capability.CaptioningService;
import com.mmrag.document.Document;
import com.mmrag.document.DocumentType;
import com.mmrag.document.Modality;
import com.mmrag.error.CapabilityUnavailableException;
import com.mmrag.error.ValidationException;

public class ImageNormalizer implements ModalityNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ImageNormalizer.class);
    public static final String CAPTION_ERROR = "caption_error";

    private final CaptioningService captioningService;
    private final CapabilityInvoker invoker;

    public ImageNormalizer(CaptioningService captioningService, CapabilityInvoker invoker) {
        this.captioningService = captioningService;
        this.invoker = invoker;
    }

    @Override
    public boolean supports(DocumentType type) {
        return type == DocumentType.IMAGE;
    }

    @Override
    public List<NormalizedUnit> normalize(Document document) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(document.content()));
        if (image == null) {
            throw new ValidationException("Not a decodable image: " + document.sourceName());
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("width", image.getWidth());
        metadata.put("height", image.getHeight());
        return List.of(describe(document.content(), document.sourceName(), Modality.IMAGE, metadata));
    }

    NormalizedUnit describe(byte[] image, String name, Modality modality, Map<String, Object> metadata) {
        Map<String, Object> unitMetadata = new LinkedHashMap<>(metadata);
        String text;
        try {
            text = invoker.read("captioning", () -> captioningService.caption(image, name));
            unitMetadata.put(CAPTION_ERROR, false);
        } catch (CapabilityUnavailableException e) {
            log.warn("normalize.image.caption_failed source={} reason={}", name, e.getMessage());
            text = "Image %s (caption unavailable: %s)".formatted(name, e.getMessage());
            unitMetadata.put(CAPTION_ERROR, true);
        }
        return new NormalizedUnit(text, modality, unitMetadata);
    }
}
