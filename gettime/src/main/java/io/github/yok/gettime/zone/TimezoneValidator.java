package io.github.yok.gettime.zone;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Checks zone identifiers against the {@link TimezoneDatabase} identifier list.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@RequiredArgsConstructor
public class TimezoneValidator {

    private final TimezoneDatabase timezoneDatabase;

    /**
     * Returns whether the identifier is known to the database. Matching is case-sensitive, as in
     * tzdata.
     *
     * @param timezone zone identifier, may be {@code null}
     * @return {@code true} if the identifier is listed
     */
    public boolean isValid(String timezone) {
        if (StringUtils.isBlank(timezone)) {
            return false;
        }
        return timezoneDatabase.listIdentifiers().contains(timezone);
    }

    /**
     * Returns all known identifiers in ascending order.
     *
     * @return sorted identifiers
     */
    public List<String> availableTimezones() {
        return ImmutableList.sortedCopyOf(Ordering.natural(), timezoneDatabase.listIdentifiers());
    }
}
