package io.github.yok.gettime.format;

import java.time.ZonedDateTime;

/**
 * Renders a zoned date-time with a strftime-style format string.
 *
 * @author Yasuharu.Okawauchi
 */
public interface TimestampRenderer {

    /**
     * Renders the date-time.
     *
     * @param dateTime date-time to render
     * @param format strftime-style format
     * @return rendered text
     * @throws IllegalArgumentException if the format contains an unknown directive
     * @throws java.time.DateTimeException if a field cannot be printed
     */
    String render(ZonedDateTime dateTime, String format);
}
