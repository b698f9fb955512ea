package recurrent.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Invocation descriptor of the job a recurring definition triggers: a target
 * type, a method on it, and named string arguments in declaration order.
 *
 * <p>The scheduler core treats it as opaque apart from equality and
 * serialization.
 *
 * @param type      fully-qualified target type name
 * @param method    method name
 * @param arguments named arguments, in order (never {@code null})
 */
public record JobInvocation(String type, String method, Map<String, String> arguments) {

  public JobInvocation {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(method, "method");
    if (type.isBlank()) {
      throw new IllegalArgumentException("type must not be blank");
    }
    if (method.isBlank()) {
      throw new IllegalArgumentException("method must not be blank");
    }
    arguments = arguments == null || arguments.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
  }

  public static JobInvocation of(String type, String method) {
    return new JobInvocation(type, method, Map.of());
  }
}
