package com.mmrag.retrieval;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mmrag.error.ValidationException;

public enum RetrievalStrategy {
    SEMANTIC("semantic"),
    HYBRID("hybrid"),
    EXPANDED("expanded");

    private final String label;

    RetrievalStrategy(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static RetrievalStrategy parse(String value) {
        if (value == null) {
            throw new ValidationException("Retrieval strategy must not be null");
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(strategy -> strategy.label.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown retrieval strategy '" + value + "', expected one of "
                        + Arrays.stream(values()).map(RetrievalStrategy::label).collect(Collectors.joining(", "))));
    }
}
