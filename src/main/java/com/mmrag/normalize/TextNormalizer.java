package com.mmrag.normalize;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.mmrag.document.Document;
import com.mmrag.document.DocumentType;
import com.mmrag.document.Modality;
import com.mmrag.error.ValidationException;

public class TextNormalizer implements ModalityNormalizer {
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[\\t\\x0B\\f \\u00A0]+");
    private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" ?\\n ?");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    @Override
    public boolean supports(DocumentType type) {
        return type == DocumentType.TEXT;
    }

    @Override
    public List<NormalizedUnit> normalize(Document document) {
        String text = clean(decode(document));
        return List.of(new NormalizedUnit(text, Modality.TEXT, Map.of("text_length", text.length())));
    }

    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String text = LINE_BREAK.matcher(raw).replaceAll("\n");
        text = HORIZONTAL_SPACE.matcher(text).replaceAll(" ");
        text = SPACE_AROUND_NEWLINE.matcher(text).replaceAll("\n");
        text = EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n");
        return text.strip();
    }

    private static String decode(Document document) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(document.content()))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new ValidationException("Text document is not valid UTF-8: " + document.sourceName(), e);
        }
    }
}
