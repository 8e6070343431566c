package com.example.awardcertificates.service.storage;

import com.example.awardcertificates.config.CertificateProperties;
import com.example.awardcertificates.exception.FormatException;
import com.example.awardcertificates.exception.FormatException.Kind;
import com.example.awardcertificates.model.SourceFormat;
import com.example.awardcertificates.model.UploadedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Validates raw uploads and writes them below the configured upload directory,
 * one sub-directory per day.
 */
@Component
public class UploadStorage {

    private static final Logger log = LoggerFactory.getLogger(UploadStorage.class);
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter STAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path rootDirectory;
    private final long maxFileSize;
    private final List<String> allowedExtensions;
    private final Clock clock;

    public UploadStorage(CertificateProperties properties, Clock clock) {
        CertificateProperties.Upload upload = properties.getUpload();
        this.rootDirectory = Paths.get(upload.getDirectory()).toAbsolutePath().normalize();
        this.maxFileSize = upload.getMaxFileSize().toBytes();
        this.allowedExtensions = upload.getAllowedExtensions().stream()
                .map(extension -> extension.trim().toLowerCase(Locale.ROOT))
                .toList();
        this.clock = clock;
    }

    /**
     * Checks size and type of an upload before anything is stored.
     *
     * @param declaredType MIME type sent by the client, may be {@code null}
     * @return the format the upload will be processed as
     */
    public SourceFormat validate(byte[] bytes, String originalName, String declaredType) {
        if (bytes == null || bytes.length == 0) {
            throw new FormatException(Kind.EMPTY_INPUT, "Uploaded file is empty");
        }
        if (bytes.length > maxFileSize) {
            throw new FormatException(Kind.FILE_TOO_LARGE, "Uploaded file is " + bytes.length
                    + " bytes; the limit is " + maxFileSize + " bytes");
        }
        String extension = extensionOf(originalName);
        Optional<SourceFormat> resolved = extension.isEmpty()
                ? SourceFormat.fromDeclaredType(declaredType)
                : SourceFormat.fromDeclaredType(extension);
        SourceFormat format = resolved.orElseThrow(() -> unsupported(originalName));
        if (extension.isEmpty()) {
            extension = format.primaryExtension();
        }
        if (!allowedExtensions.contains(extension)) {
            throw unsupported(originalName);
        }
        return format;
    }

    public UploadedFile store(byte[] bytes, String originalName, SourceFormat format, String ownerAccountId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Path directory = rootDirectory.resolve(DAY_FORMAT.format(now));
        String fileName = String.format("user%s_%s_%04x.%s", ownerAccountId, STAMP_FORMAT.format(now),
                ThreadLocalRandom.current().nextInt(0x10000), format.primaryExtension());
        Path target = directory.resolve(fileName);
        try {
            Files.createDirectories(directory);
            Files.write(target, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            long written = Files.size(target);
            if (written != bytes.length) {
                Files.deleteIfExists(target);
                throw new IOException("Expected " + bytes.length + " bytes but " + written + " were written");
            }
        } catch (IOException ex) {
            log.error("Failed to store upload {} for account {}", originalName, ownerAccountId, ex);
            throw new UncheckedIOException("Could not store uploaded file " + originalName, ex);
        }
        log.info("Stored upload {} ({} bytes) at {}", originalName, bytes.length, target);
        return new UploadedFile(null, ownerAccountId, originalName, target.toString(), format, bytes.length, now);
    }

    public byte[] read(UploadedFile file) {
        try {
            return Files.readAllBytes(Paths.get(file.storedPath()));
        } catch (IOException ex) {
            throw new UncheckedIOException("Stored upload " + file.fileId() + " cannot be read", ex);
        }
    }

    private static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 ? fileName.substring(dot + 1).trim().toLowerCase(Locale.ROOT) : "";
    }

    private FormatException unsupported(String originalName) {
        return new FormatException(Kind.UNSUPPORTED_FORMAT, "File '" + originalName
                + "' is not an accepted certificate format. Accepted: " + String.join(", ", allowedExtensions));
    }
}
