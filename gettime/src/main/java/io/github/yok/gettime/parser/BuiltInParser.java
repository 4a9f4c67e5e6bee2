package io.github.yok.gettime.parser;

import io.github.yok.gettime.model.TimestampInput;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers that are always part of the chain, declared in trial order.
 *
 * <ol>
 * <li>{@link #ISO8601}: {@code 2024-01-15T14:30:00Z}, {@code 2024-01-15T14:30:00+09:00}</li>
 * <li>{@link #RFC3339}: {@code 2024-01-15T14:30:00+00:00}</li>
 * <li>{@link #DATE_ONLY}: {@code 2024-01-15}</li>
 * <li>{@link #STANDARD}: {@code 2024-01-15 14:30:00}</li>
 * <li>{@link #US}: {@code 01/15/2024 14:30:00}</li>
 * <li>{@link #EU}: {@code 15/01/2024 14:30:00}</li>
 * <li>{@link #ISO_LOCAL}: {@code 2024-01-15T14:30:00}</li>
 * </ol>
 *
 * <p>
 * Every parser returns {@link Optional#empty()} both when the shape does not match and when a
 * matched field is out of range (e.g. month 13), so the chain can move on.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum BuiltInParser {

    ISO8601 {
        @Override
        public Optional<TimestampInput> parse(String timestamp) {
            return parseZoned(timestamp);
        }
    },

    // RFC 3339 is a profile of ISO-8601; both go through the same zone-aware parse
    RFC3339 {
        @Override
        public Optional<TimestampInput> parse(String timestamp) {
            return parseZoned(timestamp);
        }
    },

    DATE_ONLY {
        @Override
        public Optional<TimestampInput> parse(String timestamp) {
            try {
                return Optional.of(TimestampInput
                        .date(LocalDate.parse(timestamp, DateTimeFormatter.ISO_LOCAL_DATE)));
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        }
    },

    STANDARD {
        @Override
        public Optional<TimestampInput> parse(String timestamp) {
            return parseGroups(TimestampPatterns.STANDARD, timestamp, 1, 2, 3);
        }
    },

    US {
        @Override
        public Optional<TimestampInput> parse(String timestamp) {
            return parseGroups(TimestampPatterns.SLASH_DATE_TIME, timestamp, 3, 1, 2);
        }
    },

    EU {
        @Override
        public Optional<TimestampInput> parse(String timestamp) {
            return parseGroups(TimestampPatterns.SLASH_DATE_TIME, timestamp, 3, 2, 1);
        }
    },

    ISO_LOCAL {
        @Override
        public Optional<TimestampInput> parse(String timestamp) {
            try {
                return Optional.of(TimestampInput.naive(
                        LocalDateTime.parse(timestamp, DateTimeFormatter.ISO_LOCAL_DATE_TIME)));
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        }
    };

    /**
     * Parses the trimmed timestamp.
     *
     * @param timestamp trimmed timestamp string
     * @return parsed value, or empty if this parser does not accept the string
     */
    public abstract Optional<TimestampInput> parse(String timestamp);

    private static Optional<TimestampInput> parseZoned(String timestamp) {
        try {
            return Optional.of(TimestampInput
                    .zoned(ZonedDateTime.parse(timestamp, DateTimeFormatter.ISO_ZONED_DATE_TIME)));
        } catch (DateTimeException e) {
            // fall through to the space-separated form
        }
        try {
            return Optional.of(TimestampInput.zoned(
                    ZonedDateTime.parse(timestamp, TimestampPatterns.ZONED_DATE_TIME_SPACE)));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<TimestampInput> parseGroups(Pattern pattern, String timestamp,
            int year, int month, int day) {
        Matcher m = pattern.matcher(timestamp);
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(
                    TimestampInput.naive(MatchGroups.localDateTime(m, year, month, day, 4, 5, 6)));
        } catch (DateTimeException | NumberFormatException e) {
            return Optional.empty();
        }
    }
}
