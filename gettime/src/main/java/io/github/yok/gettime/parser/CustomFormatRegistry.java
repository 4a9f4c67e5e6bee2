package io.github.yok.gettime.parser;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.github.yok.gettime.config.GettimeProperties;
import io.github.yok.gettime.config.GettimeProperties.CustomInputFormat;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Process-wide list of custom input formats, consulted before the built-in parsers.
 *
 * <p>
 * Registrations are prepended, so the most recently registered format is tried first. Duplicate
 * patterns are allowed and all of them are tried. The list is never mutated in place: each
 * registration swaps in a new immutable list, and readers always see a complete snapshot.
 * </p>
 *
 * <p>
 * When created from {@link GettimeProperties}, the configured formats are loaded so that the first
 * declared entry ends up first in the list.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class CustomFormatRegistry {

    private final AtomicReference<ImmutableList<CustomFormat>> formats =
            new AtomicReference<>(ImmutableList.of());

    /**
     * Creates an empty registry.
     */
    public CustomFormatRegistry() {}

    /**
     * Creates a registry preloaded with {@code gettime.custom-input-formats}.
     *
     * @param properties bound configuration
     * @throws IllegalArgumentException if a configured entry has a blank or invalid pattern, or no
     *         parser
     */
    @Autowired
    public CustomFormatRegistry(GettimeProperties properties) {
        List<CustomInputFormat> configured = properties.getCustomInputFormats();
        if (configured == null) {
            return;
        }
        for (CustomInputFormat entry : Lists.reverse(configured)) {
            if (StringUtils.isBlank(entry.getPattern())) {
                throw new IllegalArgumentException(
                        "gettime.custom-input-formats[].pattern must not be blank");
            }
            if (entry.getParser() == null) {
                throw new IllegalArgumentException(
                        "gettime.custom-input-formats[].parser is required for pattern "
                                + entry.getPattern());
            }
            register(entry.getPattern(), entry.getParser());
        }
    }

    /**
     * Compiles and registers a pattern.
     *
     * @param regex regular expression
     * @param parser parser invoked when the pattern is found in a timestamp
     * @return the registration
     * @throws IllegalArgumentException if {@code regex} is not a valid regular expression
     * @throws NullPointerException if an argument is {@code null}
     */
    public CustomFormat register(String regex, TimestampParser parser) {
        Preconditions.checkNotNull(regex, "regex must not be null");
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid custom format pattern: " + regex, e);
        }
        return register(pattern, parser);
    }

    /**
     * Registers a pattern ahead of every existing registration.
     *
     * @param pattern match pattern
     * @param parser parser invoked when the pattern is found in a timestamp
     * @return the registration
     * @throws NullPointerException if an argument is {@code null}
     */
    public CustomFormat register(Pattern pattern, TimestampParser parser) {
        Preconditions.checkNotNull(pattern, "pattern must not be null");
        Preconditions.checkNotNull(parser, "parser must not be null");
        CustomFormat format = new CustomFormat(pattern, parser);
        formats.updateAndGet(current -> ImmutableList.<CustomFormat>builderWithExpectedSize(
                current.size() + 1).add(format).addAll(current).build());
        log.info("Registered custom input format. pattern={}", pattern.pattern());
        return format;
    }

    /**
     * Returns the registrations whose pattern occurs in the timestamp, most recent first.
     *
     * @param timestamp trimmed timestamp string
     * @return matching registrations
     */
    public List<CustomFormat> matching(String timestamp) {
        ImmutableList.Builder<CustomFormat> matched = ImmutableList.builder();
        for (CustomFormat format : formats.get()) {
            if (format.matches(timestamp)) {
                matched.add(format);
            }
        }
        return matched.build();
    }

    /**
     * Returns a consistent snapshot of all registrations, most recent first.
     *
     * @return registrations
     */
    public List<CustomFormat> snapshot() {
        return formats.get();
    }
}
