package com.example.awardcertificates.service.normalization;

import java.awt.image.BufferedImage;

/**
 * Rasterizes the first page of a multi-page document. Certificate data is
 * expected on page one, so later pages are never rendered.
 */
public interface DocumentRenderer {

    /**
     * @param document raw document bytes
     * @return the rendered first page and the total page count of the source
     * @throws com.example.awardcertificates.exception.FormatException when the
     *         document is corrupt, protected or cannot be rendered here
     */
    RenderedPage renderFirstPage(byte[] document);

    record RenderedPage(BufferedImage image, int pageCount) {
    }
}
