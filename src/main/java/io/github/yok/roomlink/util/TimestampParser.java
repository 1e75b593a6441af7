package io.github.yok.roomlink.util;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses the timestamp text found in student records.
 *
 * <p>
 * Accepted forms, tried in order:
 * </p>
 * <ol>
 * <li>{@code yyyy-MM-dd'T'HH:mm[:ss[.fraction]]} (ISO local date-time)</li>
 * <li>{@code yyyy-MM-dd HH:mm[:ss[.fraction]]}</li>
 * <li>{@code yyyy-MM-dd}, {@code yyyy/MM/dd}, {@code yyyyMMdd} (midnight)</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
public final class TimestampParser {

    /**
     * Local date-time with a space separator and optional seconds and fraction.
     */
    static final DateTimeFormatter SPACE_SEPARATED_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE).appendLiteral(' ').appendPattern("HH:mm")
            .optionalStart().appendPattern(":ss").optionalEnd().optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd().toFormatter();

    static final DateTimeFormatter[] DATE_TIME_FORMATTERS =
            {DateTimeFormatter.ISO_LOCAL_DATE_TIME, SPACE_SEPARATED_DATE_TIME};

    static final DateTimeFormatter[] DATE_ONLY_FORMATTERS = {DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"), DateTimeFormatter.BASIC_ISO_DATE};

    @Generated
    private TimestampParser() {}

    /**
     * Parses the given text into a {@link Timestamp}.
     *
     * @param text timestamp text
     * @return parsed timestamp, or {@code null} for blank input
     * @throws IllegalArgumentException if none of the accepted forms match
     */
    public static Timestamp parse(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        String value = text.trim();
        for (DateTimeFormatter formatter : DATE_TIME_FORMATTERS) {
            try {
                return Timestamp.valueOf(LocalDateTime.parse(value, formatter));
            } catch (DateTimeParseException ignored) {
                // Try next format
            }
        }
        for (DateTimeFormatter formatter : DATE_ONLY_FORMATTERS) {
            try {
                return Timestamp.valueOf(LocalDate.parse(value, formatter).atStartOfDay());
            } catch (DateTimeParseException ignored) {
                // Try next format
            }
        }
        throw new IllegalArgumentException("Unsupported timestamp format: " + value);
    }
}
