package com.example.awardcertificates.service.normalization;

import com.example.awardcertificates.config.CertificateProperties;
import com.example.awardcertificates.exception.FormatException;
import com.example.awardcertificates.exception.FormatException.Kind;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;

@Component
public class PdfBoxDocumentRenderer implements DocumentRenderer {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDocumentRenderer.class);

    private final float dpi;

    public PdfBoxDocumentRenderer(CertificateProperties properties) {
        this.dpi = properties.getNormalization().getRenderDpi();
    }

    @Override
    public RenderedPage renderFirstPage(byte[] document) {
        try (PDDocument pdf = PDDocument.load(document)) {
            int pageCount = pdf.getNumberOfPages();
            if (pageCount == 0) {
                throw new FormatException(Kind.CORRUPT_INPUT, "Document contains no pages");
            }
            BufferedImage firstPage = new PDFRenderer(pdf).renderImageWithDPI(0, dpi, ImageType.RGB);
            log.debug("Rendered page 1 of {} at {} dpi ({}x{})", pageCount, dpi,
                    firstPage.getWidth(), firstPage.getHeight());
            return new RenderedPage(firstPage, pageCount);
        } catch (InvalidPasswordException ex) {
            throw new FormatException(Kind.PASSWORD_PROTECTED,
                    "Document is password protected; upload an unprotected copy or an image of the certificate", ex);
        } catch (IOException ex) {
            throw new FormatException(Kind.CORRUPT_INPUT, "Document could not be decoded: " + ex.getMessage(), ex);
        } catch (NoClassDefFoundError | UnsatisfiedLinkError ex) {
            throw unavailable(ex);
        }
    }

    private FormatException unavailable(Throwable cause) {
        String message = "PDF rendering is not available in this environment. "
                + "Ensure PDFBox and a headless AWT runtime are installed, or upload the certificate as JPG/PNG.";
        log.error(message, cause);
        return new FormatException(Kind.CONVERSION_TOOL_UNAVAILABLE, message, cause);
    }
}
