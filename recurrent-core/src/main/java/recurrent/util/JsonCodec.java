package recurrent.util;

import java.util.Map;

/**
 * Codec for flat {@code Map<String, String>} JSON objects, as used by the
 * recurring job payload format.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no external
 * dependencies. Applications with Jackson or Gson on the classpath can plug in
 * their own implementation.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a string map as a JSON object, preserving iteration order.
   * An empty map encodes as {@code {}}.
   *
   * @throws IllegalArgumentException if the map holds null keys or values
   */
  String toJson(Map<String, String> values);

  /**
   * Parses a JSON object whose values are all strings.
   *
   * @return parsed map in document order (never {@code null})
   * @throws IllegalArgumentException if the input is blank or not a flat string object
   */
  Map<String, String> parseObject(String json);
}
