package mailrelay.util;

import java.util.List;
import java.util.Map;

/**
 * Minimal JSON codec for the two shapes the pipeline stores or sends: flat objects with
 * string values (notification payloads) and arrays of strings (recipient lists).
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no external dependencies.
 * Applications that already carry a JSON library can implement this interface instead.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a string map as a JSON object.
   *
   * @throws IllegalArgumentException if the map contains a null key
   */
  String writeObject(Map<String, String> fields);

  /**
   * Parses a JSON object and returns its string-valued members.
   *
   * <p>Members whose value is a number, boolean, null, object or array are skipped, so
   * producers may add fields of any type without breaking older readers.
   *
   * @throws IllegalArgumentException if the input is not a well-formed JSON object
   */
  Map<String, String> readObject(String json);

  /**
   * Encodes a list of strings as a JSON array.
   */
  String writeStringArray(List<String> values);

  /**
   * Parses a JSON array whose elements are all strings.
   *
   * @throws IllegalArgumentException if the input is not a JSON array of strings
   */
  List<String> readStringArray(String json);
}
