package io.github.yok.gettime.parser;

import io.github.yok.gettime.model.TimestampInput;
import java.time.DateTimeException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Custom-format parsers shipped with the registry, referenced by name from
 * {@code gettime.custom-input-formats[].parser}.
 *
 * <p>
 * Both read six capture groups of the registered pattern; they differ only in group order.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum NamedFormatParser implements TimestampParser {

    /**
     * Groups in year, month, day, hour, minute, second order, e.g. for
     * {@code ^(\d{4})\.(\d{2})\.(\d{2})\s+(\d{2}):(\d{2}):(\d{2})$}.
     */
    DOT(1, 2, 3),

    /**
     * Groups in day, month, year, hour, minute, second order, e.g. for
     * {@code ^(\d{2})-(\d{2})-(\d{4})\s+(\d{2}):(\d{2}):(\d{2})$}.
     */
    DMY(3, 2, 1);

    private final int yearGroup;
    private final int monthGroup;
    private final int dayGroup;

    NamedFormatParser(int yearGroup, int monthGroup, int dayGroup) {
        this.yearGroup = yearGroup;
        this.monthGroup = monthGroup;
        this.dayGroup = dayGroup;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<TimestampInput> parse(String timestamp, Pattern pattern) {
        Matcher m = pattern.matcher(timestamp);
        if (!m.find() || m.groupCount() < 6) {
            return Optional.empty();
        }
        try {
            return Optional.of(TimestampInput.naive(
                    MatchGroups.localDateTime(m, yearGroup, monthGroup, dayGroup, 4, 5, 6)));
        } catch (DateTimeException | NumberFormatException e) {
            return Optional.empty();
        }
    }
}
