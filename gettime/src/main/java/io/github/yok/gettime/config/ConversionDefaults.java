package io.github.yok.gettime.config;

import lombok.Value;

/**
 * Defaults read once per conversion call. Later changes to {@link GettimeProperties} do not affect
 * a snapshot already taken.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ConversionDefaults {

    String dbTimezone;

    String userTimezone;

    String format;
}
