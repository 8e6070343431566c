package com.example.awardcertificates.util;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;

/**
 * Normalizes the award dates printed on certificates to ISO {@code yyyy-MM-dd}.
 */
public final class AwardDateNormalizer {

    private static final List<DateTimeFormatter> FORMATS = List.of(
            strict("uuuu-M-d"),
            strict("uuuu/M/d"),
            strict("uuuu年M月d日"),
            strict("uuuu.M.d"),
            strict("uuuuMMdd"));

    private AwardDateNormalizer() {
    }

    public static Optional<String> normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String candidate = raw.trim().replaceAll("\\s+", "");
        return FORMATS.stream()
                .map(format -> parse(candidate, format))
                .flatMap(Optional::stream)
                .findFirst()
                .map(LocalDate::toString);
    }

    private static Optional<LocalDate> parse(String candidate, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.parse(candidate, format));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
