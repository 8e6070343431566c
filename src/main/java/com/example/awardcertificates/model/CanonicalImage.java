package com.example.awardcertificates.model;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Objects;

/**
 * PNG encoded RGB raster produced by the normalizer. This is the only image
 * representation handed to the recognition service.
 */
public final class CanonicalImage {

    public static final String MEDIA_TYPE = "image/png";

    private final byte[] png;
    private final int width;
    private final int height;
    private final SourceFormat sourceFormat;
    private final int sourcePageCount;

    public CanonicalImage(byte[] png, int width, int height, SourceFormat sourceFormat, int sourcePageCount) {
        Objects.requireNonNull(png, "png");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Canonical image dimensions must be positive");
        }
        this.png = png.clone();
        this.width = width;
        this.height = height;
        this.sourceFormat = sourceFormat;
        this.sourcePageCount = sourcePageCount;
    }

    public byte[] png() {
        return png.clone();
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public SourceFormat sourceFormat() {
        return sourceFormat;
    }

    public int sourcePageCount() {
        return sourcePageCount;
    }

    public BufferedImage toBufferedImage() {
        try {
            return ImageIO.read(new ByteArrayInputStream(png));
        } catch (IOException ex) {
            throw new UncheckedIOException("Canonical image could not be decoded", ex);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CanonicalImage that)) {
            return false;
        }
        return width == that.width && height == that.height && Arrays.equals(png, that.png);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(width, height) + Arrays.hashCode(png);
    }

    @Override
    public String toString() {
        return "CanonicalImage[" + width + "x" + height + ", " + png.length + " bytes, source=" + sourceFormat + "]";
    }
}
