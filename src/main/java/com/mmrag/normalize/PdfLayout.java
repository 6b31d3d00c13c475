package com.mmrag.normalize;

import java.util.List;

public enum PdfLayout {
    TEXT_ONLY("text_only"),
    IMAGE_ONLY("image_only"),
    MIXED("mixed");

    private final String label;

    PdfLayout(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    static PdfLayout classify(List<Boolean> textPages) {
        boolean anyText = textPages.contains(Boolean.TRUE);
        boolean anyImage = textPages.contains(Boolean.FALSE);
        if (anyText && anyImage) {
            return MIXED;
        }
        return anyText ? TEXT_ONLY : IMAGE_ONLY;
    }
}
