package io.github.yok.gettime.config;

import com.google.common.collect.Lists;
import io.github.yok.gettime.parser.NamedFormatParser;
import java.util.List;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Property class holding conversion defaults and configured custom input formats.
 *
 * <p>
 * Specify the following properties in {@code application.yml}.
 * </p>
 * <ul>
 * <li>{@code gettime.default-db-timezone}: zone of naive timestamps read from the database
 * (default {@code UTC})</li>
 * <li>{@code gettime.default-user-timezone}: zone used when the caller passes none (default
 * {@code UTC})</li>
 * <li>{@code gettime.default-format}: strftime-style output format (default
 * {@code %Y-%m-%d %H:%M:%S %Z})</li>
 * <li>{@code gettime.slash-date-order}: see {@link SlashDateOrder} (default
 * {@link SlashDateOrder#STRICT})</li>
 * <li>{@code gettime.custom-input-formats}: extra string formats tried before the built-in
 * parsers</li>
 * </ul>
 *
 * <pre>
 * gettime:
 *   default-user-timezone: America/New_York
 *   custom-input-formats:
 *     - pattern: '^(\d{4})\.(\d{2})\.(\d{2})\s+(\d{2}):(\d{2}):(\d{2})$'
 *       parser: DOT
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "gettime")
@Getter
@Setter
@NoArgsConstructor
public class GettimeProperties {

    public static final String DEFAULT_TIMEZONE = "UTC";

    public static final String DEFAULT_FORMAT = "%Y-%m-%d %H:%M:%S %Z";

    private String defaultDbTimezone = DEFAULT_TIMEZONE;

    private String defaultUserTimezone = DEFAULT_TIMEZONE;

    private String defaultFormat = DEFAULT_FORMAT;

    private SlashDateOrder slashDateOrder = SlashDateOrder.STRICT;

    /**
     * Custom input formats, tried in declared order.
     */
    private List<CustomInputFormat> customInputFormats = Lists.newArrayList();

    /**
     * Takes an immutable snapshot of the current defaults.
     *
     * @return defaults for one conversion call
     */
    public ConversionDefaults snapshot() {
        return new ConversionDefaults(defaultDbTimezone, defaultUserTimezone, defaultFormat);
    }

    /**
     * One configured custom input format.
     */
    @Data
    public static class CustomInputFormat {
        // Regular expression located with Matcher#find()
        private String pattern;
        // Shipped parser reading the pattern's capture groups
        private NamedFormatParser parser;
    }
}
