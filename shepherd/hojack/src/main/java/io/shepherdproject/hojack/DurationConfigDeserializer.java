package io.shepherdproject.hojack;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.io.IOException;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads durations written the way HOCON users write them ("500ms", "1 s", "12h"), falling back to
 * ISO-8601 ("PT30S").
 */
public class DurationConfigDeserializer extends JsonDeserializer<Duration> {
  public static final Module JACKSON_MODULE = new SimpleModule("hojack-duration")
          .addDeserializer(Duration.class, new DurationConfigDeserializer())
          .addSerializer(Duration.class, ToStringSerializer.instance);
  private static final Pattern DURATION_PATTERN = Pattern.compile("(\\d+)\\s*([a-z]+)");
  private static final Map<String, ChronoUnit> UNITS = new HashMap<>();

  static {
    alias(ChronoUnit.NANOS, "ns", "nanosecond", "nanoseconds");
    alias(ChronoUnit.MICROS, "us", "microsecond", "microseconds");
    alias(ChronoUnit.MILLIS, "ms", "millisecond", "milliseconds");
    alias(ChronoUnit.SECONDS, "s", "second", "seconds");
    alias(ChronoUnit.MINUTES, "m", "min", "mins", "minute", "minutes");
    alias(ChronoUnit.HOURS, "h", "hour", "hours");
    alias(ChronoUnit.DAYS, "d", "day", "days");
  }

  private static void alias(ChronoUnit unit, String... suffixes) {
    for (String suffix : suffixes) {
      UNITS.put(suffix, unit);
    }
  }

  @Override
  public Duration deserialize(JsonParser jsonParser, DeserializationContext context) throws IOException {
    if (jsonParser.currentToken().isNumeric()) {
      // HOCON treats a bare number as milliseconds
      return Duration.ofMillis(jsonParser.getLongValue());
    }
    return parse(jsonParser.getValueAsString());
  }

  public static Duration parse(String duration) {
    Matcher matcher = DURATION_PATTERN.matcher(duration.trim());
    if (matcher.matches()) {
      ChronoUnit unit = UNITS.get(matcher.group(2));
      if (unit != null) {
        return Duration.of(Long.parseLong(matcher.group(1)), unit);
      }
    }
    return Duration.parse(duration);
  }
}
