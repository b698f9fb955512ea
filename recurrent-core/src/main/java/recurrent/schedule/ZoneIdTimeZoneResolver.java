package recurrent.schedule;

import recurrent.spi.TimeZoneResolver;

import java.time.ZoneId;

/**
 * Resolves identifiers with {@link ZoneId#of(String)}, so region ids
 * ({@code Europe/Berlin}), {@code UTC} and offsets ({@code +02:00}) are accepted.
 */
public final class ZoneIdTimeZoneResolver implements TimeZoneResolver {

  @Override
  public ZoneId resolve(String id) {
    return ZoneId.of(id.trim());
  }
}
