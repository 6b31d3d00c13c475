package com.mmrag.capability;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.mmrag.store.TermOverlap;

/**
 * Offline embedder based on feature hashing. Words, word-boundary trigrams and adjacent word
 * pairs are hashed into a fixed number of buckets with sublinear term frequency, then the
 * vector is scaled to unit length. Stop words contribute little so captions and questions
 * line up on their content words.
 */
public class LocalModelEmbeddingService implements EmbeddingService {
    private static final String VERSION = "local-hashed-v1";
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");
    private static final float WORD_WEIGHT = 1.0f;
    private static final float STOP_WORD_WEIGHT = 0.2f;
    private static final float TRIGRAM_WEIGHT = 0.35f;
    private static final float PAIR_WEIGHT = 0.5f;

    private final int dimension;

    public LocalModelEmbeddingService(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        Map<String, Float> features = new HashMap<>();
        Matcher words = WORD.matcher(text.toLowerCase(Locale.ROOT));
        String previous = null;
        while (words.find()) {
            String word = words.group();
            boolean stopWord = TermOverlap.isStopWord(word);
            features.merge("w:" + word, stopWord ? STOP_WORD_WEIGHT : WORD_WEIGHT, Float::sum);
            if (!stopWord) {
                String padded = "<" + word + ">";
                for (int i = 0; i + 3 <= padded.length(); i++) {
                    features.merge("t:" + padded.substring(i, i + 3), TRIGRAM_WEIGHT, Float::sum);
                }
                if (previous != null) {
                    features.merge("p:" + previous + "_" + word, PAIR_WEIGHT, Float::sum);
                }
                previous = word;
            }
        }

        for (Map.Entry<String, Float> feature : features.entrySet()) {
            vector[Math.floorMod(feature.getKey().hashCode(), dimension)] += (float) Math.log1p(feature.getValue());
        }
        normalize(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return VERSION;
    }

    private static void normalize(float[] vector) {
        double norm = 0;
        for (float value : vector) {
            norm += value * value;
        }
        if (norm == 0) {
            return;
        }
        float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
    }
}
