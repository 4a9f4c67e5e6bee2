package io.github.yok.gettime;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.gettime.config.ConversionDefaults;
import io.github.yok.gettime.config.GettimeProperties;
import io.github.yok.gettime.core.TimestampFormatter;
import io.github.yok.gettime.core.TimestampNormalizer;
import io.github.yok.gettime.core.TimezoneConverter;
import io.github.yok.gettime.format.StrftimeRenderer;
import io.github.yok.gettime.model.ConversionError;
import io.github.yok.gettime.model.ConversionErrorKind;
import io.github.yok.gettime.model.ConversionResult;
import io.github.yok.gettime.model.TimestampInput;
import io.github.yok.gettime.parser.CustomFormat;
import io.github.yok.gettime.parser.CustomFormatRegistry;
import io.github.yok.gettime.parser.TimestampParser;
import io.github.yok.gettime.parser.TimestampParserChain;
import io.github.yok.gettime.zone.JavaTimeZoneDatabase;
import io.github.yok.gettime.zone.TimezoneDatabase;
import io.github.yok.gettime.zone.TimezoneValidator;
import java.time.ZoneId;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Entry point for converting database timestamps into a user's timezone and format.
 *
 * <p>
 * A conversion resolves its defaults once from {@link GettimeProperties}, then runs
 * {@link TimestampNormalizer}, {@link TimezoneConverter} and {@link TimestampFormatter},
 * stopping at the first failure. Accepted timestamps are described in {@link TimestampInput}.
 * </p>
 *
 * <pre>
 * gettime.convert("2024-01-15T14:30:00Z", "America/Los_Angeles");
 * // Ok(2024-01-15 06:30:00 PST)
 * gettime.convert(1705329000L, "Europe/London");
 * // Ok(2024-01-15 14:30:00 GMT)
 * gettime.convert("01/15/2024 14:30:00", "Asia/Tokyo", "%B %d, %Y at %I:%M %p");
 * // Ok(January 15, 2024 at 11:30 PM)
 * </pre>
 *
 * <p>
 * Every method is safe to call concurrently. The only shared mutable state is the
 * {@link CustomFormatRegistry}; a format registered before a call starts is visible to that call.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see GettimeProperties
 * @see CustomFormatRegistry
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Gettime {

    private final GettimeProperties properties;
    private final TimezoneValidator timezoneValidator;
    private final CustomFormatRegistry customFormatRegistry;
    private final TimestampNormalizer normalizer;
    private final TimezoneConverter timezoneConverter;
    private final TimestampFormatter formatter;

    /**
     * Wires a stand-alone instance on the JDK timezone database and the strftime renderer, for use
     * outside a Spring context.
     *
     * @param properties conversion defaults and configured custom formats
     * @return ready-to-use instance
     */
    public static Gettime create(GettimeProperties properties) {
        TimezoneDatabase database = new JavaTimeZoneDatabase();
        CustomFormatRegistry registry = new CustomFormatRegistry(properties);
        TimestampParserChain chain = new TimestampParserChain(registry, properties);
        return new Gettime(properties, new TimezoneValidator(database), registry,
                new TimestampNormalizer(database, chain), new TimezoneConverter(database),
                new TimestampFormatter(new StrftimeRenderer()));
    }

    /**
     * Converts a timestamp to the default user timezone and format.
     *
     * @param timestamp any value accepted by {@link TimestampInput#from(Object)}
     * @return formatted text or the first failure
     */
    public ConversionResult<String> convert(Object timestamp) {
        return convert(timestamp, null, null);
    }

    /**
     * Converts a timestamp to the given timezone with the default format.
     *
     * @param timestamp any value accepted by {@link TimestampInput#from(Object)}
     * @param userTimezone target zone id, or {@code null} for the configured default
     * @return formatted text or the first failure
     */
    public ConversionResult<String> convert(Object timestamp, String userTimezone) {
        return convert(timestamp, userTimezone, null);
    }

    /**
     * Converts a timestamp.
     *
     * @param timestamp any value accepted by {@link TimestampInput#from(Object)}
     * @param userTimezone target zone id, or {@code null} for the configured default
     * @param format strftime-style format, or {@code null} for the configured default
     * @return formatted text or the first failure
     */
    public ConversionResult<String> convert(Object timestamp, String userTimezone,
            String format) {
        ConversionResult<ResolvedSettings> settings = resolve(userTimezone, format);
        return settings.flatMap(resolved -> runPipeline(TimestampInput.from(timestamp), resolved));
    }

    /**
     * Converts every timestamp with the same resolved settings.
     *
     * <p>
     * All or nothing: the first failing element (in input order) ends the batch and its error is
     * returned; no partial list is ever produced.
     * </p>
     *
     * @param timestamps values accepted by {@link TimestampInput#from(Object)}
     * @param userTimezone target zone id, or {@code null} for the configured default
     * @param format strftime-style format, or {@code null} for the configured default
     * @return formatted texts in input order, or the first failure
     * @throws NullPointerException if {@code timestamps} is {@code null}
     */
    public ConversionResult<List<String>> convertBatch(List<?> timestamps, String userTimezone,
            String format) {
        Preconditions.checkNotNull(timestamps, "timestamps must not be null");
        ConversionResult<ResolvedSettings> settings = resolve(userTimezone, format);
        if (!settings.isOk()) {
            return ConversionResult.failure(settings.getError());
        }

        ImmutableList.Builder<String> converted =
                ImmutableList.builderWithExpectedSize(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            ConversionResult<String> result =
                    runPipeline(TimestampInput.from(timestamps.get(i)), settings.getValue());
            if (!result.isOk()) {
                log.debug("Batch conversion stopped. index={}, size={}, error={}", i,
                        timestamps.size(), result.getError());
                return ConversionResult.failure(result.getError());
            }
            converted.add(result.getValue());
        }
        return ConversionResult.ok(converted.build());
    }

    /**
     * Converts every timestamp to the given timezone with the default format.
     *
     * @param timestamps values accepted by {@link TimestampInput#from(Object)}
     * @param userTimezone target zone id, or {@code null} for the configured default
     * @return formatted texts in input order, or the first failure
     */
    public ConversionResult<List<String>> convertBatch(List<?> timestamps, String userTimezone) {
        return convertBatch(timestamps, userTimezone, null);
    }

    /**
     * Converts every timestamp with the configured defaults.
     *
     * @param timestamps values accepted by {@link TimestampInput#from(Object)}
     * @return formatted texts in input order, or the first failure
     */
    public ConversionResult<List<String>> convertBatch(List<?> timestamps) {
        return convertBatch(timestamps, null, null);
    }

    /**
     * Registers a custom input format, tried before every earlier registration and before the
     * built-in formats.
     *
     * @param regex regular expression located in the trimmed timestamp
     * @param parser parser receiving the timestamp and the compiled pattern
     * @return the registration
     * @throws IllegalArgumentException if {@code regex} is not a valid regular expression
     * @throws NullPointerException if an argument is {@code null}
     */
    public CustomFormat addCustomFormat(String regex, TimestampParser parser) {
        return customFormatRegistry.register(regex, parser);
    }

    /**
     * Registers a custom input format.
     *
     * @param pattern pattern located in the trimmed timestamp
     * @param parser parser receiving the timestamp and {@code pattern}
     * @return the registration
     * @throws NullPointerException if an argument is {@code null}
     */
    public CustomFormat addCustomFormat(Pattern pattern, TimestampParser parser) {
        return customFormatRegistry.register(pattern, parser);
    }

    /**
     * Returns every known zone id in ascending order.
     *
     * @return zone ids
     */
    public List<String> availableTimezones() {
        return timezoneValidator.availableTimezones();
    }

    /**
     * Returns whether the zone id is known.
     *
     * @param timezone zone id, may be {@code null}
     * @return {@code true} if valid
     */
    public boolean isValidTimezone(String timezone) {
        return timezoneValidator.isValid(timezone);
    }

    private ConversionResult<String> runPipeline(TimestampInput input,
            ResolvedSettings settings) {
        return normalizer.normalize(input, settings.dbZone)
                .flatMap(normalized -> timezoneConverter.convert(normalized, settings.userZone))
                .flatMap(converted -> formatter.render(converted, settings.format));
    }

    private ConversionResult<ResolvedSettings> resolve(String userTimezone, String format) {
        ConversionDefaults defaults = properties.snapshot();

        String dbTimezone = defaults.getDbTimezone();
        if (!timezoneValidator.isValid(dbTimezone)) {
            log.warn("Invalid gettime.default-db-timezone: {}", dbTimezone);
            return ConversionResult.failure(ConversionError.withValue(
                    ConversionErrorKind.INVALID_DB_TIMEZONE_CONFIG, dbTimezone));
        }

        String targetTimezone = userTimezone;
        if (targetTimezone == null) {
            targetTimezone = defaults.getUserTimezone();
            if (StringUtils.isBlank(targetTimezone)) {
                log.warn("Invalid gettime.default-user-timezone: {}", targetTimezone);
                return ConversionResult.failure(ConversionError.withValue(
                        ConversionErrorKind.INVALID_USER_TIMEZONE_CONFIG, targetTimezone));
            }
        }
        if (!timezoneValidator.isValid(targetTimezone)) {
            return ConversionResult.failure(ConversionError
                    .withValue(ConversionErrorKind.INVALID_TIMEZONE, targetTimezone));
        }

        String formatString = format;
        if (formatString == null) {
            formatString = StringUtils.isBlank(defaults.getFormat())
                    ? GettimeProperties.DEFAULT_FORMAT
                    : defaults.getFormat();
        }

        return ConversionResult.ok(new ResolvedSettings(ZoneId.of(dbTimezone),
                ZoneId.of(targetTimezone), formatString));
    }

    /**
     * Settings resolved once per call (once per batch).
     */
    @RequiredArgsConstructor
    private static final class ResolvedSettings {
        private final ZoneId dbZone;
        private final ZoneId userZone;
        private final String format;
    }
}
