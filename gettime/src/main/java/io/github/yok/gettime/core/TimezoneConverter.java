package io.github.yok.gettime.core;

import io.github.yok.gettime.model.ConversionError;
import io.github.yok.gettime.model.ConversionErrorKind;
import io.github.yok.gettime.model.ConversionResult;
import io.github.yok.gettime.zone.TimezoneDatabase;
import io.github.yok.gettime.zone.TimezoneDatabaseException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Re-anchors a zoned date-time to the target zone. The identifier is validated by the caller.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TimezoneConverter {

    private final TimezoneDatabase timezoneDatabase;

    /**
     * Shifts the date-time to {@code targetZone}.
     *
     * @param dateTime normalized date-time
     * @param targetZone target zone
     * @return shifted date-time, or {@link ConversionErrorKind#TIMEZONE_CONVERSION_FAILED}
     */
    public ConversionResult<ZonedDateTime> convert(ZonedDateTime dateTime, ZoneId targetZone) {
        try {
            return ConversionResult.ok(timezoneDatabase.shift(dateTime, targetZone));
        } catch (TimezoneDatabaseException e) {
            log.warn("Timezone shift failed. dateTime={}, zone={}", dateTime, targetZone, e);
            return ConversionResult.failure(ConversionError.withDetail(
                    ConversionErrorKind.TIMEZONE_CONVERSION_FAILED, targetZone.getId(),
                    e.getMessage()));
        }
    }
}
