package recurrent.spring;

import org.springframework.scheduling.support.CronExpression;
import recurrent.schedule.CronFormatException;
import recurrent.spi.CronEvaluator;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link CronEvaluator} backed by Spring's {@link CronExpression}.
 *
 * <p>Evaluation happens on {@link ZonedDateTime}s in the requested zone, so
 * daylight saving transitions follow Spring's rules.
 *
 * <p>Parsed expressions are cached; the cache holds at most {@code maxCacheSize}
 * entries and is cleared when full.
 */
public final class SpringCronEvaluator implements CronEvaluator {
  public static final int DEFAULT_MAX_CACHE_SIZE = 1024;

  private final Map<String, CronExpression> cache = new ConcurrentHashMap<>();
  private final int maxCacheSize;

  public SpringCronEvaluator() {
    this(DEFAULT_MAX_CACHE_SIZE);
  }

  public SpringCronEvaluator(int maxCacheSize) {
    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0");
    }
    this.maxCacheSize = maxCacheSize;
  }

  @Override
  public Optional<Instant> nextOccurrence(String cronExpression, Instant from, ZoneId zone) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(zone, "zone");
    ZonedDateTime next = parse(cronExpression).next(from.atZone(zone));
    return next == null ? Optional.empty() : Optional.of(next.toInstant());
  }

  /**
   * @throws CronFormatException if Spring rejects the expression
   */
  CronExpression parse(String cronExpression) {
    Objects.requireNonNull(cronExpression, "cronExpression");
    CronExpression cached = cache.get(cronExpression);
    if (cached != null) {
      return cached;
    }
    CronExpression parsed;
    try {
      parsed = CronExpression.parse(cronExpression);
    } catch (IllegalArgumentException e) {
      throw new CronFormatException("Invalid cron expression '" + cronExpression + "': " + e.getMessage(), e);
    }
    if (cache.size() >= maxCacheSize) {
      cache.clear();
    }
    cache.put(cronExpression, parsed);
    return parsed;
  }

  int cacheSize() {
    return cache.size();
  }
}
