package io.github.yok.gettime.zone;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Set;

/**
 * Abstraction over the IANA timezone database.
 *
 * @author Yasuharu.Okawauchi
 */
public interface TimezoneDatabase {

    /**
     * Returns every zone identifier known to the database.
     *
     * @return zone identifiers
     */
    Set<String> listIdentifiers();

    /**
     * Re-anchors an instant to another zone, preserving the point in time.
     *
     * @param dateTime instant to shift
     * @param zone target zone
     * @return the same instant expressed in {@code zone}
     * @throws TimezoneDatabaseException if the zone rules cannot be applied
     */
    ZonedDateTime shift(ZonedDateTime dateTime, ZoneId zone) throws TimezoneDatabaseException;

    /**
     * Attaches a zone to a local date-time.
     *
     * <p>
     * Implementations must report local times that fall into an offset transition (gap or
     * overlap) instead of picking an offset on the caller's behalf.
     * </p>
     *
     * @param localDateTime wall-clock date-time
     * @param zone zone to attach
     * @return anchored date-time
     * @throws TimezoneDatabaseException if the local time does not exist or is ambiguous in
     *         {@code zone}
     */
    ZonedDateTime anchor(LocalDateTime localDateTime, ZoneId zone)
            throws TimezoneDatabaseException;
}
