package recurrent.schedule;

import recurrent.spi.CronEvaluator;
import recurrent.spi.JobPayloadCodec;
import recurrent.spi.TimeZoneResolver;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;

/**
 * Builds {@link RecurringJobDefinition} instances from stored field maps with
 * a fixed set of collaborators.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RecurringJobFactory {
  private final TimeZoneResolver timeZoneResolver;
  private final JobPayloadCodec payloadCodec;
  private final CronEvaluator cronEvaluator;
  private final ZoneId defaultTimeZone;

  private RecurringJobFactory(Builder builder) {
    this.cronEvaluator = Objects.requireNonNull(builder.cronEvaluator, "cronEvaluator");
    this.timeZoneResolver = builder.timeZoneResolver != null
        ? builder.timeZoneResolver : new ZoneIdTimeZoneResolver();
    this.payloadCodec = builder.payloadCodec != null ? builder.payloadCodec : new JsonJobPayloadCodec();
    this.defaultTimeZone = builder.defaultTimeZone != null
        ? builder.defaultTimeZone : RecurringJobDefinition.DEFAULT_TIME_ZONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @throws UnsupportedMisfireModeException if the stored misfire option is unknown
   */
  public RecurringJobDefinition create(String id, Map<String, String> fields, Instant now) {
    return create(id, RecurringJobSnapshot.of(fields), now);
  }

  /**
   * @throws UnsupportedMisfireModeException if the stored misfire option is unknown
   */
  public RecurringJobDefinition create(String id, RecurringJobSnapshot snapshot, Instant now) {
    return new RecurringJobDefinition(id, snapshot, timeZoneResolver, payloadCodec, cronEvaluator,
        defaultTimeZone, now);
  }

  public JobPayloadCodec payloadCodec() {
    return payloadCodec;
  }

  public TimeZoneResolver timeZoneResolver() {
    return timeZoneResolver;
  }

  /** Builder for {@link RecurringJobFactory}. */
  public static final class Builder {
    private TimeZoneResolver timeZoneResolver;
    private JobPayloadCodec payloadCodec;
    private CronEvaluator cronEvaluator;
    private ZoneId defaultTimeZone;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder cronEvaluator(CronEvaluator cronEvaluator) {
      this.cronEvaluator = cronEvaluator;
      return this;
    }

    /** Optional. Defaults to {@link ZoneIdTimeZoneResolver}. */
    public Builder timeZoneResolver(TimeZoneResolver timeZoneResolver) {
      this.timeZoneResolver = timeZoneResolver;
      return this;
    }

    /** Optional. Defaults to {@link JsonJobPayloadCodec}. */
    public Builder payloadCodec(JobPayloadCodec payloadCodec) {
      this.payloadCodec = payloadCodec;
      return this;
    }

    /**
     * Zone applied to definitions that store no time zone.
     *
     * <p>Optional. Defaults to {@code UTC}.
     */
    public Builder defaultTimeZone(ZoneId defaultTimeZone) {
      this.defaultTimeZone = defaultTimeZone;
      return this;
    }

    public RecurringJobFactory build() {
      return new RecurringJobFactory(this);
    }
  }
}
