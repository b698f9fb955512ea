package recurrent.spi;

import java.time.ZoneId;

/**
 * Resolves persisted time zone identifiers.
 *
 * @see recurrent.schedule.ZoneIdTimeZoneResolver
 */
@FunctionalInterface
public interface TimeZoneResolver {

    /**
     * @param id time zone identifier as stored on a recurring job
     * @return the resolved zone
     * @throws java.time.DateTimeException if the identifier is unknown
     */
    ZoneId resolve(String id);
}
