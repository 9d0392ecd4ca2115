package io.intellixity.matviews.jobs;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Lenient decoding of queue-serialized job arguments. */
final class JobArgs {
  private static final Set<String> TRUEISH = Set.of("true", "1", "yes");

  private JobArgs() {}

  static long definitionId(Object raw) {
    if (raw instanceof Number n) return n.longValue();
    if (raw instanceof String s) {
      try {
        return Long.parseLong(s.trim());
      } catch (NumberFormatException e) {
        throw new MatViewJobException("Invalid definition id: \"" + s + "\"");
      }
    }
    throw new MatViewJobException("Invalid definition id: " + raw);
  }

  /** {@code arg} itself, or {@code arg[key]} when it is a map. */
  static Object option(Object arg, String key) {
    return (arg instanceof Map<?, ?> m) ? m.get(key) : arg;
  }

  /** Map lookup only; scalar arguments yield null. */
  static Object mapOption(Object arg, String key) {
    return (arg instanceof Map<?, ?> m) ? m.get(key) : null;
  }

  /** {@code true}, {@code "true"/"1"/"yes"} (any case) and the integer {@code 1}. */
  static boolean trueish(Object value) {
    if (value instanceof Boolean b) return b;
    if (value instanceof String s) return TRUEISH.contains(s.strip().toLowerCase(Locale.ROOT));
    if (value instanceof Integer || value instanceof Long) return ((Number) value).longValue() == 1L;
    return false;
  }
}
