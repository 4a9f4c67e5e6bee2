package io.github.yok.gettime.parser;

import io.github.yok.gettime.model.TimestampInput;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Strategy that interprets a timestamp string matched by a registered pattern.
 *
 * <p>
 * Implementations return a {@link TimestampInput} of kind {@code ZONED}, {@code NAIVE} or
 * {@code DATE}, or {@link Optional#empty()} when the string cannot be interpreted. Exceptions
 * thrown from {@link #parse(String, Pattern)} are treated like an empty result by the parser
 * chain.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface TimestampParser {

    /**
     * Parses the timestamp.
     *
     * @param timestamp trimmed timestamp string
     * @param pattern the pattern this parser was registered with
     * @return parsed value, or empty when the string is not understood
     */
    Optional<TimestampInput> parse(String timestamp, Pattern pattern);
}
