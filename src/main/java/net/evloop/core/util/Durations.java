package net.evloop.core.util;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses durations written as an amount and an optional unit, e.g. {@code 250ms}, {@code 5s},
 * {@code 2m} or {@code 1h}. A bare amount is read as milliseconds.
 */
public final class Durations {
  private static final Pattern PARSER = Pattern.compile("(\\d+)\\s*([a-zA-Z]*)$");

  private Durations() {
  }

  public static Duration fromString(String value) {
    Matcher matcher = PARSER.matcher(value.strip());
    Preconditions.checkArgument(matcher.matches(), "unsupported format: %s", value);
    long amount = Long.parseLong(matcher.group(1));
    String unit = matcher.group(2).strip().toLowerCase();

    switch (unit) {
      case "":
      case "ms":
        return Duration.ofMillis(amount);
      case "s":
        return Duration.ofSeconds(amount);
      case "m":
        return Duration.ofMinutes(amount);
      case "h":
        return Duration.ofHours(amount);
      default:
        throw new IllegalArgumentException("unknown unit: " + unit);
    }
  }
}
