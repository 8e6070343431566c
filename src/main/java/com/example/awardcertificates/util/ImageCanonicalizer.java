package com.example.awardcertificates.util;

import javax.imageio.ImageIO;
import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Brings any decoded raster into the canonical form sent to recognition:
 * opaque 24-bit RGB, longest side bounded, PNG encoded. Applying the steps to
 * an image that is already canonical leaves its pixels unchanged.
 */
public final class ImageCanonicalizer {

    private ImageCanonicalizer() {
    }

    public static BufferedImage canonicalize(BufferedImage input, int maxDimension) {
        if (input == null) {
            throw new IllegalArgumentException("Input image cannot be null");
        }
        if (maxDimension <= 0) {
            throw new IllegalArgumentException("Max dimension must be positive");
        }
        BufferedImage rgb = toOpaqueRgb(input);
        return downscaleIfNeeded(rgb, maxDimension);
    }

    public static byte[] encodePng(BufferedImage image) {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", outputStream)) {
                throw new IllegalStateException("No PNG writer available");
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to encode canonical image", ex);
        }
        return outputStream.toByteArray();
    }

    private static BufferedImage toOpaqueRgb(BufferedImage input) {
        BufferedImage rgb = new BufferedImage(input.getWidth(), input.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, input.getWidth(), input.getHeight());
            g.setComposite(AlphaComposite.SrcOver);
            g.drawImage(input, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private static BufferedImage downscaleIfNeeded(BufferedImage input, int maxDimension) {
        int width = input.getWidth();
        int height = input.getHeight();
        if (width <= maxDimension && height <= maxDimension) {
            return input;
        }
        double ratio = Math.min((double) maxDimension / width, (double) maxDimension / height);
        int targetWidth = Math.max(1, (int) Math.round(width * ratio));
        int targetHeight = Math.max(1, (int) Math.round(height * ratio));

        BufferedImage scaled = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.drawImage(input, 0, 0, targetWidth, targetHeight, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }
}
