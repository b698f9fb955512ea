package recurrent.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} for flat string-to-string objects.
 */
final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  private DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> values) {
    StringBuilder sb = new StringBuilder("{");
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        throw new IllegalArgumentException("JSON object cannot contain null keys or values");
      }
      if (sb.length() > 1) {
        sb.append(',');
      }
      appendString(sb, entry.getKey());
      sb.append(':');
      appendString(sb, entry.getValue());
    }
    return sb.append('}').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null || json.isBlank()) {
      throw new IllegalArgumentException("JSON input is empty");
    }
    Cursor cursor = new Cursor(json);
    cursor.expect('{');
    Map<String, String> result = new LinkedHashMap<>();
    if (cursor.consumeIf('}')) {
      cursor.expectEnd();
      return result;
    }
    do {
      String key = cursor.readString();
      cursor.expect(':');
      String value = cursor.readString();
      if (result.put(key, value) != null) {
        throw new IllegalArgumentException("Duplicate key: " + key);
      }
    } while (cursor.consumeIf(','));
    cursor.expect('}');
    cursor.expectEnd();
    return result;
  }

  private static void appendString(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    sb.append('"');
  }

  private static final class Cursor {
    private final String input;
    private int index;

    private Cursor(String input) {
      this.input = input;
    }

    void expect(char expected) {
      skipWhitespace();
      if (index >= input.length() || input.charAt(index) != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at position " + index);
      }
      index++;
    }

    boolean consumeIf(char candidate) {
      skipWhitespace();
      if (index < input.length() && input.charAt(index) == candidate) {
        index++;
        return true;
      }
      return false;
    }

    void expectEnd() {
      skipWhitespace();
      if (index != input.length()) {
        throw new IllegalArgumentException("Unexpected trailing content at position " + index);
      }
    }

    String readString() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (index < input.length()) {
        char c = input.charAt(index++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (index >= input.length()) {
          break;
        }
        char escaped = input.charAt(index++);
        switch (escaped) {
          case '"', '\\', '/' -> sb.append(escaped);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> sb.append(readUnicode());
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private char readUnicode() {
      if (index + 4 > input.length()) {
        throw new IllegalArgumentException("Invalid unicode escape");
      }
      String hex = input.substring(index, index + 4);
      index += 4;
      try {
        return (char) Integer.parseInt(hex, 16);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid unicode escape: " + hex, e);
      }
    }

    private void skipWhitespace() {
      while (index < input.length() && Character.isWhitespace(input.charAt(index))) {
        index++;
      }
    }
  }
}
