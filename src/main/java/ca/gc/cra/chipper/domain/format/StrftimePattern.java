package ca.gc.cra.chipper.domain.format;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Compiled strftime-style pattern rendered against a {@link ZonedDateTime}.
 *
 * <p>Supported directives: {@code %Y %y %m %d %e %H %I %M %S %f %p %j %a %A %b %B %Z %z %%}. Names are
 * rendered in English regardless of the default locale so output stays stable across hosts.</p>
 *
 * @since 0.1.0
 */
public final class StrftimePattern {
  private static final DateTimeFormatter ZONE_NAME = DateTimeFormatter.ofPattern("zzz", Locale.ENGLISH);
  private static final DateTimeFormatter ZONE_OFFSET = DateTimeFormatter.ofPattern("xx", Locale.ENGLISH);

  private final String source;
  private final List<Part> parts;

  private StrftimePattern(String source, List<Part> parts) {
    this.source = source;
    this.parts = parts;
  }

  /**
   * Parses a strftime pattern.
   *
   * @param source pattern such as {@code %Y-%m-%d}; must not be {@code null}
   * @return compiled pattern
   * @throws TemplateException if the pattern uses an unsupported directive or ends with a lone {@code %}
   */
  public static StrftimePattern compile(String source) {
    Objects.requireNonNull(source, "source");
    List<Part> parts = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    for (int i = 0; i < source.length(); i++) {
      char c = source.charAt(i);
      if (c != '%') {
        literal.append(c);
        continue;
      }
      if (i + 1 >= source.length()) {
        throw new TemplateException("dangling '%' in date/time format '" + source + "'");
      }
      char directive = source.charAt(++i);
      if (directive == '%') {
        literal.append('%');
        continue;
      }
      Part part = directive(directive, source);
      if (literal.length() > 0) {
        String text = literal.toString();
        parts.add((out, ts) -> out.append(text));
        literal.setLength(0);
      }
      parts.add(part);
    }
    if (literal.length() > 0) {
      String text = literal.toString();
      parts.add((out, ts) -> out.append(text));
    }
    return new StrftimePattern(source, List.copyOf(parts));
  }

  /**
   * Formats the timestamp.
   *
   * @param timestamp value to render; must not be {@code null}
   * @return rendered text
   */
  public String format(ZonedDateTime timestamp) {
    Objects.requireNonNull(timestamp, "timestamp");
    StringBuilder out = new StringBuilder(source.length() + 16);
    for (Part part : parts) {
      part.append(out, timestamp);
    }
    return out.toString();
  }

  private static Part directive(char directive, String source) {
    return switch (directive) {
      case 'Y' -> (out, ts) -> out.append(pad(ts.getYear(), 4, '0'));
      case 'y' -> (out, ts) -> out.append(pad(Math.floorMod(ts.getYear(), 100), 2, '0'));
      case 'm' -> (out, ts) -> out.append(pad(ts.getMonthValue(), 2, '0'));
      case 'd' -> (out, ts) -> out.append(pad(ts.getDayOfMonth(), 2, '0'));
      case 'e' -> (out, ts) -> out.append(pad(ts.getDayOfMonth(), 2, ' '));
      case 'H' -> (out, ts) -> out.append(pad(ts.getHour(), 2, '0'));
      case 'I' -> (out, ts) -> out.append(pad(clockHour(ts.getHour()), 2, '0'));
      case 'M' -> (out, ts) -> out.append(pad(ts.getMinute(), 2, '0'));
      case 'S' -> (out, ts) -> out.append(pad(ts.getSecond(), 2, '0'));
      case 'f' -> (out, ts) -> out.append(pad(ts.getNano() / 1_000, 6, '0'));
      case 'p' -> (out, ts) -> out.append(ts.getHour() < 12 ? "AM" : "PM");
      case 'j' -> (out, ts) -> out.append(pad(ts.getDayOfYear(), 3, '0'));
      case 'a' -> (out, ts) -> out.append(ts.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH));
      case 'A' -> (out, ts) -> out.append(ts.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
      case 'b' -> (out, ts) -> out.append(ts.getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH));
      case 'B' -> (out, ts) -> out.append(ts.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
      case 'Z' -> (out, ts) -> out.append(ZONE_NAME.format(ts));
      case 'z' -> (out, ts) -> out.append(ZONE_OFFSET.format(ts));
      default -> throw new TemplateException(
          "unsupported directive '%" + directive + "' in date/time format '" + source + "'");
    };
  }

  private static int clockHour(int hour) {
    int h = hour % 12;
    return h == 0 ? 12 : h;
  }

  private static String pad(int value, int width, char fill) {
    String digits = Integer.toString(value);
    if (digits.length() >= width) {
      return digits;
    }
    StringBuilder sb = new StringBuilder(width);
    for (int i = digits.length(); i < width; i++) {
      sb.append(fill);
    }
    return sb.append(digits).toString();
  }

  @Override
  public String toString() {
    return source;
  }

  @FunctionalInterface
  private interface Part {
    void append(StringBuilder out, ZonedDateTime timestamp);
  }
}
