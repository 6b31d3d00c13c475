package com.mmrag.normalize;

import java.io.IOException;
import java.util.List;

import com.mmrag.document.Document;
import com.mmrag.document.DocumentType;

public interface ModalityNormalizer {
    boolean supports(DocumentType type);

    List<NormalizedUnit> normalize(Document document) throws IOException;
}
