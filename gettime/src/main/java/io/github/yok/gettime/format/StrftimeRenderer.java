package io.github.yok.gettime.format;

import com.google.common.base.Preconditions;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.SignStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalField;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link TimestampRenderer} that compiles strftime directives onto a {@link DateTimeFormatter}.
 *
 * <p>
 * Supported directives (names are always English):
 * </p>
 * <ul>
 * <li>{@code %Y} 4-digit year, {@code %y} 2-digit year, {@code %q} quarter</li>
 * <li>{@code %m} month, {@code %b}/{@code %B} abbreviated/full month name</li>
 * <li>{@code %d} day of month, {@code %e} space-padded day, {@code %j} day of year</li>
 * <li>{@code %a}/{@code %A} abbreviated/full weekday name, {@code %u} ISO weekday (1-7)</li>
 * <li>{@code %H} 24-hour, {@code %I} 12-hour, {@code %M} minute, {@code %S} second,
 * {@code %f} microseconds</li>
 * <li>{@code %p} {@code AM}/{@code PM}, {@code %P} {@code am}/{@code pm}</li>
 * <li>{@code %z} offset ({@code +0900}), {@code %Z} zone abbreviation ({@code JST})</li>
 * <li>{@code %c}, {@code %x}, {@code %X} shorthand for {@code %Y-%m-%d %H:%M:%S},
 * {@code %Y-%m-%d}, {@code %H:%M:%S}</li>
 * <li>{@code %%} a literal percent sign</li>
 * </ul>
 *
 * <p>
 * A {@code -} flag after {@code %} drops zero padding of numeric directives ({@code %-d}). Any
 * other character is copied literally. Compiled formats are cached.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class StrftimeRenderer implements TimestampRenderer {

    private static final Map<Long, String> AM_PM_UPPER = ImmutableMap.of(0L, "AM", 1L, "PM");

    private static final Map<Long, String> AM_PM_LOWER = ImmutableMap.of(0L, "am", 1L, "pm");

    private final LoadingCache<String, DateTimeFormatter> compiled = CacheBuilder.newBuilder()
            .maximumSize(256).build(CacheLoader.from(StrftimeRenderer::compile));

    /**
     * {@inheritDoc}
     */
    @Override
    public String render(ZonedDateTime dateTime, String format) {
        Preconditions.checkNotNull(dateTime, "dateTime must not be null");
        Preconditions.checkNotNull(format, "format must not be null");
        DateTimeFormatter formatter;
        try {
            formatter = compiled.getUnchecked(format);
        } catch (UncheckedExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
        return formatter.format(dateTime);
    }

    /**
     * Compiles a strftime format.
     *
     * @param format strftime-style format
     * @return equivalent formatter
     * @throws IllegalArgumentException on an unknown directive or a trailing {@code %}
     */
    static DateTimeFormatter compile(String format) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder();
        appendFormat(builder, format);
        log.debug("Compiled strftime format. format={}", format);
        return builder.toFormatter(Locale.ENGLISH);
    }

    private static void appendFormat(DateTimeFormatterBuilder builder, String format) {
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i++);
            if (c != '%') {
                builder.appendLiteral(c);
                continue;
            }
            boolean pad = true;
            if (i < format.length() && format.charAt(i) == '-') {
                pad = false;
                i++;
            }
            if (i >= format.length()) {
                throw new IllegalArgumentException(
                        "Invalid strftime format: incomplete directive at end of \"" + format
                                + "\"");
            }
            appendDirective(builder, format.charAt(i++), pad, format);
        }
    }

    private static void appendDirective(DateTimeFormatterBuilder builder, char directive,
            boolean pad, String format) {
        switch (directive) {
            case 'Y':
                if (pad) {
                    builder.appendValue(ChronoField.YEAR, 4, 10, SignStyle.NORMAL);
                } else {
                    builder.appendValue(ChronoField.YEAR);
                }
                break;
            case 'y':
                builder.appendValueReduced(ChronoField.YEAR, 2, 2, 2000);
                break;
            case 'q':
                builder.appendValue(IsoFields.QUARTER_OF_YEAR);
                break;
            case 'm':
                number(builder, ChronoField.MONTH_OF_YEAR, 2, pad);
                break;
            case 'd':
                number(builder, ChronoField.DAY_OF_MONTH, 2, pad);
                break;
            case 'e':
                builder.padNext(2).appendValue(ChronoField.DAY_OF_MONTH);
                break;
            case 'j':
                number(builder, ChronoField.DAY_OF_YEAR, 3, pad);
                break;
            case 'u':
                builder.appendValue(ChronoField.DAY_OF_WEEK);
                break;
            case 'H':
                number(builder, ChronoField.HOUR_OF_DAY, 2, pad);
                break;
            case 'I':
                number(builder, ChronoField.CLOCK_HOUR_OF_AMPM, 2, pad);
                break;
            case 'M':
                number(builder, ChronoField.MINUTE_OF_HOUR, 2, pad);
                break;
            case 'S':
                number(builder, ChronoField.SECOND_OF_MINUTE, 2, pad);
                break;
            case 'f':
                builder.appendValue(ChronoField.MICRO_OF_SECOND, 6);
                break;
            case 'a':
                builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.SHORT);
                break;
            case 'A':
                builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.FULL);
                break;
            case 'b':
                builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.SHORT);
                break;
            case 'B':
                builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.FULL);
                break;
            case 'p':
                builder.appendText(ChronoField.AMPM_OF_DAY, AM_PM_UPPER);
                break;
            case 'P':
                builder.appendText(ChronoField.AMPM_OF_DAY, AM_PM_LOWER);
                break;
            case 'z':
                builder.appendOffset("+HHMM", "+0000");
                break;
            case 'Z':
                builder.appendZoneText(TextStyle.SHORT);
                break;
            case 'c':
                appendFormat(builder, "%Y-%m-%d %H:%M:%S");
                break;
            case 'x':
                appendFormat(builder, "%Y-%m-%d");
                break;
            case 'X':
                appendFormat(builder, "%H:%M:%S");
                break;
            case '%':
                builder.appendLiteral('%');
                break;
            default:
                throw new IllegalArgumentException(
                        "Invalid strftime format: %" + directive + " in \"" + format + "\"");
        }
    }

    private static void number(DateTimeFormatterBuilder builder, TemporalField field, int width,
            boolean pad) {
        if (pad) {
            builder.appendValue(field, width);
        } else {
            builder.appendValue(field);
        }
    }
}
