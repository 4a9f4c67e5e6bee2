package io.github.yok.gettime.model;

import com.google.common.base.Preconditions;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Closed set of timestamp shapes accepted by the conversion pipeline.
 *
 * <p>
 * Each instance carries a {@link Kind} tag and the caller-provided value. Typed factories exist for
 * every supported shape; {@link #from(Object)} classifies an arbitrary value and tags anything it
 * does not recognize as {@link Kind#UNSUPPORTED}.
 * </p>
 *
 * <ul>
 * <li>{@link Kind#ZONED}: {@link ZonedDateTime}</li>
 * <li>{@link Kind#NAIVE}: {@link LocalDateTime}</li>
 * <li>{@link Kind#DATE}: {@link LocalDate}</li>
 * <li>{@link Kind#EPOCH_SECONDS}: {@link Long}</li>
 * <li>{@link Kind#EPOCH_FRACTIONAL}: {@link Double}</li>
 * <li>{@link Kind#STRING}: {@link String}</li>
 * <li>{@link Kind#UNSUPPORTED}: the raw value as given (may be {@code null})</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class TimestampInput {

    private static final Instant ZONED_MIN = LocalDateTime.MIN.toInstant(ZoneOffset.UTC);

    private static final Instant ZONED_MAX = LocalDateTime.MAX.toInstant(ZoneOffset.UTC);

    /**
     * Tag of a {@link TimestampInput}.
     */
    public enum Kind {
        ZONED, NAIVE, DATE, EPOCH_SECONDS, EPOCH_FRACTIONAL, STRING, UNSUPPORTED
    }

    private final Kind kind;
    private final Object value;

    /**
     * Wraps a zoned date-time.
     *
     * @param value zoned date-time
     * @return tagged input
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public static TimestampInput zoned(ZonedDateTime value) {
        return new TimestampInput(Kind.ZONED, Preconditions.checkNotNull(value, "value"));
    }

    /**
     * Wraps a naive local date-time.
     *
     * @param value local date-time without zone
     * @return tagged input
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public static TimestampInput naive(LocalDateTime value) {
        return new TimestampInput(Kind.NAIVE, Preconditions.checkNotNull(value, "value"));
    }

    /**
     * Wraps a calendar date.
     *
     * @param value calendar date
     * @return tagged input
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public static TimestampInput date(LocalDate value) {
        return new TimestampInput(Kind.DATE, Preconditions.checkNotNull(value, "value"));
    }

    /**
     * Wraps whole seconds since the Unix epoch.
     *
     * @param seconds epoch seconds
     * @return tagged input
     */
    public static TimestampInput epochSeconds(long seconds) {
        return new TimestampInput(Kind.EPOCH_SECONDS, seconds);
    }

    /**
     * Wraps fractional seconds since the Unix epoch.
     *
     * @param seconds epoch seconds, truncated toward zero during normalization
     * @return tagged input
     */
    public static TimestampInput epochSeconds(double seconds) {
        return new TimestampInput(Kind.EPOCH_FRACTIONAL, seconds);
    }

    /**
     * Wraps a textual timestamp.
     *
     * @param value raw string
     * @return tagged input
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public static TimestampInput text(String value) {
        return new TimestampInput(Kind.STRING, Preconditions.checkNotNull(value, "value"));
    }

    /**
     * Classifies an arbitrary caller value.
     *
     * <p>
     * {@link OffsetDateTime} and {@link Instant} are accepted as zoned values (keeping the offset,
     * or UTC respectively). An {@link Instant} beyond the {@link ZonedDateTime} range becomes
     * epoch seconds. Integral boxed numbers become epoch seconds, {@link Double} and
     * {@link Float} fractional epoch seconds. Anything else, including {@code null}, is tagged
     * {@link Kind#UNSUPPORTED}.
     * </p>
     *
     * @param value caller value
     * @return tagged input, never {@code null}
     */
    public static TimestampInput from(Object value) {
        if (value instanceof TimestampInput) {
            return (TimestampInput) value;
        }
        if (value instanceof ZonedDateTime) {
            return zoned((ZonedDateTime) value);
        }
        if (value instanceof OffsetDateTime) {
            return zoned(((OffsetDateTime) value).toZonedDateTime());
        }
        if (value instanceof Instant) {
            Instant instant = (Instant) value;
            if (instant.isBefore(ZONED_MIN) || instant.isAfter(ZONED_MAX)) {
                // not representable as a ZonedDateTime; the epoch range check rejects it
                return epochSeconds(instant.getEpochSecond());
            }
            return zoned(instant.atZone(ZoneOffset.UTC));
        }
        if (value instanceof LocalDateTime) {
            return naive((LocalDateTime) value);
        }
        if (value instanceof LocalDate) {
            return date((LocalDate) value);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte) {
            return epochSeconds(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return epochSeconds(((Number) value).doubleValue());
        }
        if (value instanceof CharSequence) {
            return text(value.toString());
        }
        return new TimestampInput(Kind.UNSUPPORTED, value);
    }
}
