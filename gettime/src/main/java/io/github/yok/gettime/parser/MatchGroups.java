package io.github.yok.gettime.parser;

import java.time.LocalDateTime;
import java.util.regex.Matcher;
import lombok.Generated;

/**
 * Builds date-times from numeric regex capture groups.
 *
 * @author Yasuharu.Okawauchi
 */
final class MatchGroups {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private MatchGroups() {}

    /**
     * Reads six numeric groups as year, month, day, hour, minute and second.
     *
     * @param m matcher positioned on a successful match
     * @param year group index of the year
     * @param month group index of the month
     * @param day group index of the day
     * @param hour group index of the hour
     * @param minute group index of the minute
     * @param second group index of the second
     * @return local date-time
     * @throws NumberFormatException if a group is not a decimal integer
     * @throws java.time.DateTimeException if a field is out of range
     */
    static LocalDateTime localDateTime(Matcher m, int year, int month, int day, int hour,
            int minute, int second) {
        return LocalDateTime.of(number(m, year), number(m, month), number(m, day),
                number(m, hour), number(m, minute), number(m, second));
    }

    private static int number(Matcher m, int group) {
        return Integer.parseInt(m.group(group));
    }
}
