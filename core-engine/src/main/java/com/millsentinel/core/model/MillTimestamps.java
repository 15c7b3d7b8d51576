package com.millsentinel.core.model;

import com.millsentinel.core.error.UnparsableTimestampException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * Parsing and formatting of the historian timestamp format
 * {@code MM/DD/YYYY HH:MM}.
 *
 * <p>
 * Month, day and hour are accepted with or without zero padding, matching
 * what the export produces for early hours and single-digit dates.
 * </p>
 *
 * @since 1.0.0
 */
public final class MillTimestamps {

    private static final Logger LOG = LoggerFactory.getLogger(MillTimestamps.class);

    private static final DateTimeFormatter PARSER =
            DateTimeFormatter.ofPattern("M/d/uuuu H:mm").withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern("MM/dd/uuuu HH:mm");

    private MillTimestamps() {
        // utility class — not instantiable
    }

    /**
     * Parse a timestamp.
     *
     * @param text timestamp text, may be {@code null}
     * @return the parsed date-time
     * @throws UnparsableTimestampException if the text is missing or malformed
     */
    public static LocalDateTime parse(String text) throws UnparsableTimestampException {
        if (text == null || text.isBlank()) {
            throw new UnparsableTimestampException(text, null);
        }
        try {
            return LocalDateTime.parse(text.trim(), PARSER);
        } catch (DateTimeParseException e) {
            throw new UnparsableTimestampException(text, e);
        }
    }

    /**
     * Parse a timestamp, treating failures as absence.
     *
     * @param text timestamp text, may be {@code null}
     * @return the parsed date-time, or empty if missing or malformed
     */
    public static Optional<LocalDateTime> tryParse(String text) {
        try {
            return Optional.of(parse(text));
        } catch (UnparsableTimestampException e) {
            LOG.trace("Excluding reading: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @param dateTime the date-time to format; must not be {@code null}
     * @return zero-padded {@code MM/dd/yyyy HH:mm} text
     */
    public static String format(LocalDateTime dateTime) {
        return FORMATTER.format(dateTime);
    }
}
