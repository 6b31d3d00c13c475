package com.mmrag.chunk;

public record TextSpan(String text, int start, int end) {
    public int length() {
        return end - start;
    }
}
