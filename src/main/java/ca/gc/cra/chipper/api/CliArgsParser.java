package ca.gc.cra.chipper.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into a lookup map.
 * <p>Only the first {@code '='} separates key from value, so messages may contain {@code '='}. Stateless.</p>
 *
 * @since 0.1.0
 */
final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9_-]*$");

  private CliArgsParser() {}

  /**
   * Parses arguments restricted to a set of known keys.
   *
   * @param args {@code key=value} arguments
   * @param allowedKeys keys the command understands
   * @return insertion-ordered map; values keep inner whitespace and may be empty
   * @throws IllegalArgumentException if an argument lacks {@code '='}, repeats a key, uses an unknown key, or
   *     contains control characters
   */
  static Map<String, String> toMap(List<String> args, Set<String> allowedKeys) {
    Map<String, String> map = new LinkedHashMap<>();
    for (String arg : args) {
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + arg + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1);
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (!allowedKeys.contains(key)) {
        throw new IllegalArgumentException("unknown argument: " + key);
      }
      if (containsControl(value)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      if (map.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return map;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
