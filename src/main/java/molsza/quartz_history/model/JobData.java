package molsza.quartz_history.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts a job parameter map into the value kinds a run record keeps:
 * strings, numbers, booleans and instants.
 */
public final class JobData {

  private JobData() {
  }

  public static Map<String, Object> snapshot(Map<String, ?> source) {
    if (source == null || source.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, Object> result = new LinkedHashMap<>();
    source.forEach((key, value) -> {
      Object converted = toValue(value);
      if (key != null && converted != null) {
        result.put(key, converted);
      }
    });
    return Collections.unmodifiableMap(result);
  }

  public static Object toValue(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof String || value instanceof Number || value instanceof Boolean || value instanceof Instant) {
      return value;
    }
    if (value instanceof Date) {
      return ((Date) value).toInstant();
    }
    return value.toString();
  }
}
