package recurrent.schedule;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fields of a recurring job to rewrite, plus the next execution to index it by.
 *
 * <p>A {@code null} field value means the field is removed. An empty
 * {@code nextExecution} removes the definition from due polling.
 */
public final class ChangeSet {
  private final Map<String, String> changedFields;
  private final Instant nextExecution;
  private final boolean changed;

  ChangeSet(Map<String, String> changedFields, Instant nextExecution, boolean changed) {
    this.changedFields = Collections.unmodifiableMap(new LinkedHashMap<>(changedFields));
    this.nextExecution = nextExecution;
    this.changed = changed;
  }

  /**
   * Builds a change set that always counts as a change, for writes made
   * without a loaded definition.
   */
  public static ChangeSet of(Map<String, String> changedFields, Instant nextExecution) {
    Objects.requireNonNull(changedFields, "changedFields");
    return new ChangeSet(changedFields, nextExecution, true);
  }

  public Map<String, String> changedFields() {
    return changedFields;
  }

  public Optional<Instant> nextExecution() {
    return Optional.ofNullable(nextExecution);
  }

  /**
   * Whether anything needs to be written: a non-empty field diff, or a next
   * execution that differs from the one the definition held.
   */
  public boolean hasChanges() {
    return changed;
  }

  @Override
  public String toString() {
    return "ChangeSet{fields=" + changedFields + ", nextExecution=" + nextExecution + '}';
  }
}
