package com.mmrag.capability;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import javax.imageio.ImageIO;

import com.mmrag.error.CapabilityUnavailableException;

public class LocalImageDescriptionService implements CaptioningService {
    private static final int SAMPLE_GRID = 32;

    @Override
    public String caption(byte[] image, String name) {
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(new ByteArrayInputStream(image));
        } catch (IOException e) {
            throw new CapabilityUnavailableException("captioning", e.getMessage(), e);
        }
        if (decoded == null) {
            throw new CapabilityUnavailableException("captioning", "cannot decode " + name);
        }

        int width = decoded.getWidth();
        int height = decoded.getHeight();
        String orientation = width > height ? "landscape" : width < height ? "portrait" : "square";
        return "Image %s: %s picture of %dx%d pixels with %s, predominantly %s tones"
                .formatted(name, orientation, width, height, brightness(decoded), dominantTone(decoded));
    }

    private static String brightness(BufferedImage image) {
        double luminance = 0;
        int samples = 0;
        for (int[] rgb : sample(image)) {
            luminance += 0.2126 * rgb[0] + 0.7152 * rgb[1] + 0.0722 * rgb[2];
            samples++;
        }
        double average = luminance / Math.max(1, samples);
        if (average < 85) {
            return "dark content";
        }
        if (average > 170) {
            return "light content";
        }
        return "medium brightness";
    }

    private static String dominantTone(BufferedImage image) {
        long red = 0;
        long green = 0;
        long blue = 0;
        for (int[] rgb : sample(image)) {
            red += rgb[0];
            green += rgb[1];
            blue += rgb[2];
        }
        long max = Math.max(red, Math.max(green, blue));
        long min = Math.min(red, Math.min(green, blue));
        if (max - min < max / 10 + 1) {
            return "neutral";
        }
        if (max == red) {
            return "red";
        }
        return max == green ? "green" : "blue";
    }

    private static List<int[]> sample(BufferedImage image) {
        int stepX = Math.max(1, image.getWidth() / SAMPLE_GRID);
        int stepY = Math.max(1, image.getHeight() / SAMPLE_GRID);
        List<int[]> pixels = new ArrayList<>();
        for (int y = 0; y < image.getHeight(); y += stepY) {
            for (int x = 0; x < image.getWidth(); x += stepX) {
                int argb = image.getRGB(x, y);
                pixels.add(new int[] { (argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF });
            }
        }
        return pixels;
    }
}
