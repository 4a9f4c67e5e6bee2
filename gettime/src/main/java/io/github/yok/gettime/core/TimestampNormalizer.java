package io.github.yok.gettime.core;

import io.github.yok.gettime.model.ConversionError;
import io.github.yok.gettime.model.ConversionErrorKind;
import io.github.yok.gettime.model.ConversionResult;
import io.github.yok.gettime.model.TimestampInput;
import io.github.yok.gettime.parser.TimestampParserChain;
import io.github.yok.gettime.zone.TimezoneDatabase;
import io.github.yok.gettime.zone.TimezoneDatabaseException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns any {@link TimestampInput} into a zoned date-time anchored to a source zone.
 *
 * <ul>
 * <li>{@code ZONED}: returned unchanged.</li>
 * <li>{@code NAIVE}: anchored to the source zone.</li>
 * <li>{@code DATE}: midnight, anchored to the source zone.</li>
 * <li>{@code EPOCH_SECONDS}: seconds since 1970-01-01T00:00:00Z, in UTC.</li>
 * <li>{@code EPOCH_FRACTIONAL}: truncated toward zero, then as above.</li>
 * <li>{@code STRING}: trimmed and run through the {@link TimestampParserChain}; the parsed value is
 * normalized like the typed inputs.</li>
 * </ul>
 *
 * <p>
 * Epoch seconds are accepted for years -9999 through 9999.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TimestampNormalizer {

    /** -9999-01-01T00:00:00Z. */
    public static final long MIN_EPOCH_SECOND = -377_705_116_800L;

    /** 9999-12-31T23:59:59Z. */
    public static final long MAX_EPOCH_SECOND = 253_402_300_799L;

    private final TimezoneDatabase timezoneDatabase;

    private final TimestampParserChain parserChain;

    /**
     * Normalizes the input.
     *
     * @param input tagged timestamp
     * @param sourceZone zone that naive values and dates are interpreted in
     * @return zoned date-time or the failure of the first stage that rejected the input
     */
    public ConversionResult<ZonedDateTime> normalize(TimestampInput input, ZoneId sourceZone) {
        switch (input.getKind()) {
            case ZONED:
                return ConversionResult.ok((ZonedDateTime) input.getValue());
            case NAIVE:
                return anchor((LocalDateTime) input.getValue(), sourceZone,
                        ConversionErrorKind.DATETIME_CONVERSION_FAILED);
            case DATE:
                return anchor(((LocalDate) input.getValue()).atStartOfDay(), sourceZone,
                        ConversionErrorKind.DATE_CONVERSION_FAILED);
            case EPOCH_SECONDS:
                return fromEpochSeconds((Long) input.getValue());
            case EPOCH_FRACTIONAL:
                return fromEpochFraction((Double) input.getValue());
            case STRING:
                String trimmed = ((String) input.getValue()).trim();
                return parserChain.parse(trimmed)
                        .flatMap(parsed -> normalize(parsed, sourceZone));
            case UNSUPPORTED:
            default:
                log.debug("Unsupported timestamp input. value={}", input.getValue());
                return ConversionResult.failure(
                        ConversionError.of(ConversionErrorKind.UNSUPPORTED_TIMESTAMP_FORMAT));
        }
    }

    private ConversionResult<ZonedDateTime> anchor(LocalDateTime localDateTime, ZoneId zone,
            ConversionErrorKind failureKind) {
        try {
            return ConversionResult.ok(timezoneDatabase.anchor(localDateTime, zone));
        } catch (TimezoneDatabaseException e) {
            log.debug("Anchoring failed. localDateTime={}, zone={}", localDateTime, zone, e);
            return ConversionResult.failure(
                    ConversionError.withDetail(failureKind, localDateTime, e.getMessage()));
        }
    }

    private ConversionResult<ZonedDateTime> fromEpochFraction(double seconds) {
        if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            return ConversionResult.failure(ConversionError.withDetail(
                    ConversionErrorKind.UNIX_CONVERSION_FAILED, seconds, "not a finite number"));
        }
        // bounds are checked after truncation toward zero
        if (seconds <= MIN_EPOCH_SECOND - 1.0 || seconds >= MAX_EPOCH_SECOND + 1.0) {
            return outOfRange(seconds);
        }
        // the cast truncates toward zero
        return fromEpochSeconds((long) seconds);
    }

    private ConversionResult<ZonedDateTime> fromEpochSeconds(long seconds) {
        if (seconds < MIN_EPOCH_SECOND || seconds > MAX_EPOCH_SECOND) {
            return outOfRange(seconds);
        }
        return ConversionResult.ok(Instant.ofEpochSecond(seconds).atZone(ZoneOffset.UTC));
    }

    private static ConversionResult<ZonedDateTime> outOfRange(Object seconds) {
        return ConversionResult.failure(ConversionError.withDetail(
                ConversionErrorKind.UNIX_CONVERSION_FAILED, seconds, "epoch seconds out of range ["
                        + MIN_EPOCH_SECOND + ", " + MAX_EPOCH_SECOND + "]"));
    }
}
