package recurrent.schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable copy of a recurring job's stored field map.
 *
 * <p>Loading logic reads fields through {@link #field(String)}, which tells a
 * missing field apart from a blank one. Change detection compares against
 * {@link #raw(String)}, the text exactly as stored.
 */
public final class RecurringJobSnapshot {
  private final Map<String, String> fields;

  private RecurringJobSnapshot(Map<String, String> fields) {
    this.fields = fields;
  }

  public static RecurringJobSnapshot of(Map<String, String> fields) {
    Objects.requireNonNull(fields, "fields");
    return new RecurringJobSnapshot(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
  }

  public static RecurringJobSnapshot empty() {
    return new RecurringJobSnapshot(Map.of());
  }

  /**
   * Returns the stored text, or {@code null} when the field is missing.
   */
  public String raw(String name) {
    return fields.get(name);
  }

  public boolean contains(String name) {
    return fields.containsKey(name);
  }

  public FieldState field(String name) {
    if (!fields.containsKey(name)) {
      return Absent.INSTANCE;
    }
    String value = fields.get(name);
    if (value == null || value.isBlank()) {
      return new Blank(value == null ? "" : value);
    }
    return new Present(value);
  }

  public Map<String, String> asMap() {
    return fields;
  }

  /**
   * Returns a new snapshot with {@code changes} applied; {@code null} values remove fields.
   */
  public RecurringJobSnapshot with(Map<String, String> changes) {
    Map<String, String> merged = new LinkedHashMap<>(fields);
    changes.forEach((name, value) -> {
      if (value == null) {
        merged.remove(name);
      } else {
        merged.put(name, value);
      }
    });
    return new RecurringJobSnapshot(Collections.unmodifiableMap(merged));
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    fields.forEach((name, value) -> {
      if (sb.length() > 0) {
        sb.append(';');
      }
      sb.append(name).append(':').append(value);
    });
    return sb.toString();
  }

  /**
   * State of one stored field.
   */
  public sealed interface FieldState permits Absent, Blank, Present {

    /**
     * Returns the value when present and non-blank, otherwise {@code null}.
     */
    default String valueOrNull() {
      return this instanceof Present present ? present.value() : null;
    }
  }

  /** The field is not stored at all. */
  public static final class Absent implements FieldState {
    static final Absent INSTANCE = new Absent();

    private Absent() {
    }
  }

  /** The field is stored but empty or whitespace. */
  public record Blank(String text) implements FieldState {
  }

  /** The field is stored with a non-blank value. */
  public record Present(String value) implements FieldState {
  }
}
