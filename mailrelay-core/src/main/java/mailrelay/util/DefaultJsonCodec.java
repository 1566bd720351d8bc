package mailrelay.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Zero-dependency {@link JsonCodec}. Accessible via {@link JsonCodec#getDefault()}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String writeObject(Map<String, String> fields) {
    StringBuilder sb = new StringBuilder("{");
    boolean first = true;
    for (Map.Entry<String, String> entry : fields.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("JSON object cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      appendString(sb, entry.getKey());
      sb.append(':');
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        appendString(sb, entry.getValue());
      }
    }
    return sb.append('}').toString();
  }

  @Override
  public Map<String, String> readObject(String json) {
    Cursor in = new Cursor(json);
    in.expect('{');
    Map<String, String> result = new LinkedHashMap<>();
    if (in.consumeIf('}')) {
      in.expectEnd();
      return result;
    }
    do {
      in.skipWhitespace();
      String key = in.readString();
      in.expect(':');
      in.skipWhitespace();
      if (in.peek() == '"') {
        result.put(key, in.readString());
      } else {
        in.skipValue();
      }
    } while (in.consumeIf(','));
    in.expect('}');
    in.expectEnd();
    return result;
  }

  @Override
  public String writeStringArray(List<String> values) {
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      String value = values.get(i);
      if (value == null) {
        throw new IllegalArgumentException("JSON string array cannot contain null");
      }
      appendString(sb, value);
    }
    return sb.append(']').toString();
  }

  @Override
  public List<String> readStringArray(String json) {
    Cursor in = new Cursor(json);
    in.expect('[');
    List<String> result = new ArrayList<>();
    if (in.consumeIf(']')) {
      in.expectEnd();
      return result;
    }
    do {
      in.skipWhitespace();
      result.add(in.readString());
    } while (in.consumeIf(','));
    in.expect(']');
    in.expectEnd();
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

  /**
   * Forward-only reader over a JSON text.
   */
  private static final class Cursor {
    private final String input;
    private int pos;

    Cursor(String input) {
      if (input == null) {
        throw new IllegalArgumentException("JSON input is null");
      }
      this.input = input;
    }

    char peek() {
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON input");
      }
      return input.charAt(pos);
    }

    void skipWhitespace() {
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          return;
        }
        pos++;
      }
    }

    void expect(char expected) {
      skipWhitespace();
      if (peek() != expected) {
        throw new IllegalArgumentException(
            "Expected '" + expected + "' at position " + pos + " but found '" + peek() + "'");
      }
      pos++;
    }

    boolean consumeIf(char candidate) {
      skipWhitespace();
      if (pos < input.length() && input.charAt(pos) == candidate) {
        pos++;
        return true;
      }
      return false;
    }

    void expectEnd() {
      skipWhitespace();
      if (pos != input.length()) {
        throw new IllegalArgumentException("Trailing characters at position " + pos);
      }
    }

    String readString() {
      if (peek() != '"') {
        throw new IllegalArgumentException("Expected string at position " + pos);
      }
      pos++;
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char esc = input.charAt(pos++);
        switch (esc) {
          case '"', '\\', '/' -> sb.append(esc);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (pos + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            pos += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + esc);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    /**
     * Skips one complete value of any type. Nesting is tracked on an explicit stack, so
     * the depth of a well-formed value is bounded only by the input length.
     */
    void skipValue() {
      Deque<Character> open = new ArrayDeque<>();
      skipWhitespace();
      while (true) {
        char c = peek();
        if (c == '{') {
          pos++;
          if (!consumeIf('}')) {
            open.push('}');
            skipMemberName();
            continue;
          }
        } else if (c == '[') {
          pos++;
          if (!consumeIf(']')) {
            open.push(']');
            skipWhitespace();
            continue;
          }
        } else if (c == '"') {
          readString();
        } else {
          skipLiteral();
        }
        // A value is complete: close finished containers, or move on to the next element.
        while (true) {
          if (open.isEmpty()) {
            return;
          }
          char close = open.peek();
          if (consumeIf(',')) {
            if (close == '}') {
              skipMemberName();
            } else {
              skipWhitespace();
            }
            break;
          }
          expect(close);
          open.pop();
        }
      }
    }

    private void skipMemberName() {
      skipWhitespace();
      readString();
      expect(':');
      skipWhitespace();
    }

    // true, false, null or a number
    private void skipLiteral() {
      int start = pos;
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c == ',' || c == '}' || c == ']' || c == ' ' || c == '\t' || c == '\n' || c == '\r') {
          break;
        }
        pos++;
      }
      String literal = input.substring(start, pos);
      if (literal.equals("true") || literal.equals("false") || literal.equals("null")) {
        return;
      }
      try {
        Double.parseDouble(literal);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid JSON value at position " + start, ex);
      }
    }
  }
}
