package io.intellixity.matviews.response;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Serialized form of a failure: exception class name, message and backtrace lines. */
public record ErrorDetails(String className, String message, List<String> backtrace) {
  public ErrorDetails {
    Objects.requireNonNull(className, "className");
    backtrace = (backtrace == null) ? List.of() : List.copyOf(backtrace);
  }

  public static ErrorDetails from(Throwable t) {
    Objects.requireNonNull(t, "t");
    List<String> lines = new ArrayList<>();
    for (StackTraceElement e : t.getStackTrace()) lines.add(e.toString());
    return new ErrorDetails(t.getClass().getName(), t.getMessage(), lines);
  }

  public Map<String, Object> toMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("class", className);
    m.put("message", message);
    m.put("backtrace", backtrace);
    return m;
  }

  @SuppressWarnings("unchecked")
  public static ErrorDetails fromMap(Map<String, ?> m) {
    if (m == null) return null;
    Object bt = m.get("backtrace");
    List<String> lines = new ArrayList<>();
    if (bt instanceof List<?> l) {
      for (Object o : l) lines.add(String.valueOf(o));
    }
    Object cls = m.get("class");
    Object msg = m.get("message");
    return new ErrorDetails(cls == null ? "unknown" : String.valueOf(cls), msg == null ? null : String.valueOf(msg), lines);
  }
}
