package io.github.yok.gettime.parser;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Formatters and regular expressions shared by the built-in parsers.
 *
 * @author Yasuharu.Okawauchi
 */
public final class TimestampPatterns {

    /**
     * Zone-aware ISO-8601 date-time with a single space instead of {@code T}, e.g.
     * {@code 2024-01-15 14:30:00+09:00} or {@code 2024-01-15 14:30:00.5Z[UTC]}.
     */
    public static final DateTimeFormatter ZONED_DATE_TIME_SPACE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive().append(DateTimeFormatter.ISO_LOCAL_DATE).appendLiteral(' ')
            .appendValue(ChronoField.HOUR_OF_DAY, 2).appendLiteral(':')
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2).appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2).optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .appendOffsetId().optionalStart().appendLiteral('[').parseCaseSensitive()
            .appendZoneRegionId().appendLiteral(']').optionalEnd().toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    /**
     * {@code yyyy-MM-dd HH:mm:ss}; date and time may be separated by any whitespace run.
     */
    public static final Pattern STANDARD =
            Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})\\s+(\\d{2}):(\\d{2}):(\\d{2})$");

    /**
     * {@code NN/NN/NNNN HH:mm:ss}, shared by the US and EU orders.
     */
    public static final Pattern SLASH_DATE_TIME =
            Pattern.compile("^(\\d{2})/(\\d{2})/(\\d{4})\\s+(\\d{2}):(\\d{2}):(\\d{2})$");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private TimestampPatterns() {}
}
