package com.example.awardcertificates.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Upload formats accepted by the normalizer. Declared types may be a bare
 * extension, a file name or a MIME type.
 */
public enum SourceFormat {
    JPEG(false, List.of("jpg", "jpeg"), List.of("image/jpeg", "image/jpg", "image/pjpeg")),
    PNG(false, List.of("png"), List.of("image/png")),
    BMP(false, List.of("bmp"), List.of("image/bmp", "image/x-ms-bmp")),
    PDF(true, List.of("pdf"), List.of("application/pdf"));

    private final boolean document;
    private final List<String> extensions;
    private final List<String> mimeTypes;

    SourceFormat(boolean document, List<String> extensions, List<String> mimeTypes) {
        this.document = document;
        this.extensions = extensions;
        this.mimeTypes = mimeTypes;
    }

    public boolean isDocument() {
        return document;
    }

    public String primaryExtension() {
        return extensions.get(0);
    }

    public List<String> extensions() {
        return extensions;
    }

    public static Optional<SourceFormat> fromDeclaredType(String declaredType) {
        if (declaredType == null || declaredType.isBlank()) {
            return Optional.empty();
        }
        String value = declaredType.trim().toLowerCase(Locale.ROOT);
        int parameters = value.indexOf(';');
        if (parameters >= 0) {
            value = value.substring(0, parameters).trim();
        }
        if (value.contains("/")) {
            String mime = value;
            return Arrays.stream(values()).filter(format -> format.mimeTypes.contains(mime)).findFirst();
        }
        int dot = value.lastIndexOf('.');
        String extension = dot >= 0 ? value.substring(dot + 1) : value;
        return Arrays.stream(values()).filter(format -> format.extensions.contains(extension)).findFirst();
    }
}
