package io.github.yok.gettime.parser;

import io.github.yok.gettime.model.TimestampInput;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.NonNull;
import lombok.Value;

/**
 * One registration in the {@link CustomFormatRegistry}: a match pattern and its parser.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class CustomFormat {

    @NonNull
    Pattern pattern;

    @NonNull
    TimestampParser parser;

    /**
     * Returns whether the pattern occurs in the timestamp.
     *
     * @param timestamp trimmed timestamp string
     * @return {@code true} if {@link java.util.regex.Matcher#find()} succeeds
     */
    public boolean matches(String timestamp) {
        return pattern.matcher(timestamp).find();
    }

    /**
     * Invokes the parser with the registered pattern.
     *
     * @param timestamp trimmed timestamp string
     * @return parser result
     */
    public Optional<TimestampInput> parse(String timestamp) {
        Optional<TimestampInput> result = parser.parse(timestamp, pattern);
        return result == null ? Optional.empty() : result;
    }
}
