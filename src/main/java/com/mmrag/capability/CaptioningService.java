package com.mmrag.capability;

public interface CaptioningService {
    String caption(byte[] image, String name);
}
