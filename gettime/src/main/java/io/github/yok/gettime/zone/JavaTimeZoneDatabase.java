package io.github.yok.gettime.zone;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.zone.ZoneRules;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link TimezoneDatabase} backed by the tzdata bundled with the JDK.
 *
 * <p>
 * Anchoring is strict: a local time inside a spring-forward gap or a fall-back overlap raises
 * {@link TimezoneDatabaseException} rather than being silently shifted or resolved to the earlier
 * offset, which is what {@link LocalDateTime#atZone(ZoneId)} would do.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class JavaTimeZoneDatabase implements TimezoneDatabase {

    // ZoneId.getAvailableZoneIds() copies the set on every call
    private final Set<String> identifiers = ImmutableSet.copyOf(ZoneId.getAvailableZoneIds());

    /**
     * {@inheritDoc}
     */
    @Override
    public Set<String> listIdentifiers() {
        return identifiers;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public ZonedDateTime shift(ZonedDateTime dateTime, ZoneId zone)
            throws TimezoneDatabaseException {
        Preconditions.checkNotNull(dateTime, "dateTime must not be null");
        Preconditions.checkNotNull(zone, "zone must not be null");
        try {
            return dateTime.withZoneSameInstant(zone);
        } catch (DateTimeException e) {
            throw new TimezoneDatabaseException(
                    "Cannot shift " + dateTime + " to " + zone + ": " + e.getMessage(), e);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public ZonedDateTime anchor(LocalDateTime localDateTime, ZoneId zone)
            throws TimezoneDatabaseException {
        Preconditions.checkNotNull(localDateTime, "localDateTime must not be null");
        Preconditions.checkNotNull(zone, "zone must not be null");
        ZoneRules rules;
        try {
            rules = zone.getRules();
        } catch (DateTimeException e) {
            throw new TimezoneDatabaseException("No rules for zone " + zone, e);
        }

        List<ZoneOffset> offsets = rules.getValidOffsets(localDateTime);
        if (offsets.isEmpty()) {
            log.debug("Local time falls into a gap. localDateTime={}, zone={}", localDateTime,
                    zone);
            throw new TimezoneDatabaseException(
                    "Nonexistent local time " + localDateTime + " in " + zone);
        }
        if (offsets.size() > 1) {
            log.debug("Local time falls into an overlap. localDateTime={}, zone={}, offsets={}",
                    localDateTime, zone, offsets);
            throw new TimezoneDatabaseException("Ambiguous local time " + localDateTime + " in "
                    + zone + " (candidate offsets " + offsets + ")");
        }
        return ZonedDateTime.ofStrict(localDateTime, offsets.get(0), zone);
    }
}
