package com.questrail.hamgateway.protocol.n1mm;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;

/**
 * Timestamp formats used by N1MM Logger+ broadcasts.
 *
 * <p>N1MM sends local times without a zone, either space- or
 * {@code T}-separated. Anything else is rejected.</p>
 */
public final class N1mmTimestamps
{
    private static final List<DateTimeFormatter> FORMATS = List.of(
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss")
    );

    private N1mmTimestamps() {}

    /**
     * @throws DateTimeParseException if {@code text} matches none of the formats
     */
    public static LocalDateTime parse(String text)
    {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();

        DateTimeParseException last = null;
        for (DateTimeFormatter format : FORMATS) {
            try {
                return LocalDateTime.parse(trimmed, format);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw last;
    }
}
