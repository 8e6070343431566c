package com.example.awardcertificates.service.normalization;

import com.example.awardcertificates.config.CertificateProperties;
import com.example.awardcertificates.exception.FormatException;
import com.example.awardcertificates.exception.FormatException.Kind;
import com.example.awardcertificates.model.CanonicalImage;
import com.example.awardcertificates.model.SourceFormat;
import com.example.awardcertificates.util.ImageCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Turns an accepted upload into the single canonical raster used for
 * recognition. Documents contribute their first page only. Nothing is
 * written to storage.
 */
@Service
public class FormatNormalizer {

    private static final Logger log = LoggerFactory.getLogger(FormatNormalizer.class);

    private final DocumentRenderer documentRenderer;
    private final int maxDimension;

    public FormatNormalizer(DocumentRenderer documentRenderer, CertificateProperties properties) {
        this.documentRenderer = documentRenderer;
        this.maxDimension = properties.getNormalization().getMaxDimension();
    }

    public CanonicalImage normalize(byte[] rawBytes, String declaredType) {
        if (rawBytes == null || rawBytes.length == 0) {
            throw new FormatException(Kind.EMPTY_INPUT, "Uploaded file is empty");
        }
        SourceFormat format = SourceFormat.fromDeclaredType(declaredType)
                .orElseThrow(() -> new FormatException(Kind.UNSUPPORTED_FORMAT,
                        "Unsupported file type '" + declaredType + "'. Accepted: pdf, jpg, jpeg, png, bmp"));

        BufferedImage source;
        int pageCount = 1;
        if (format.isDocument()) {
            DocumentRenderer.RenderedPage page = documentRenderer.renderFirstPage(rawBytes);
            source = page.image();
            pageCount = page.pageCount();
            if (pageCount > 1) {
                log.debug("Document has {} pages; only page 1 is used for recognition", pageCount);
            }
        } else {
            source = decodeImage(rawBytes, format);
        }

        BufferedImage canonical = ImageCanonicalizer.canonicalize(source, maxDimension);
        byte[] png = ImageCanonicalizer.encodePng(canonical);
        log.debug("Normalized {} input {}x{} to canonical {}x{}", format, source.getWidth(), source.getHeight(),
                canonical.getWidth(), canonical.getHeight());
        return new CanonicalImage(png, canonical.getWidth(), canonical.getHeight(), format, pageCount);
    }

    private BufferedImage decodeImage(byte[] rawBytes, SourceFormat format) {
        try (ByteArrayInputStream inputStream = new ByteArrayInputStream(rawBytes)) {
            BufferedImage image = ImageIO.read(inputStream);
            if (image == null) {
                throw new FormatException(Kind.CORRUPT_INPUT, "Unable to decode " + format + " image data");
            }
            return image;
        } catch (IOException ex) {
            throw new FormatException(Kind.CORRUPT_INPUT, "Failed to read " + format + " image data", ex);
        }
    }
}
