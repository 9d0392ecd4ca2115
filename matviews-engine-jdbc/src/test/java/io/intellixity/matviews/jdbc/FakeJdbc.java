package io.intellixity.matviews.jdbc;

import javax.sql.DataSource;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Proxy-backed {@link DataSource} that records connection calls and statement binds, and answers queries from
 * scripted rows.
 * <p>
 * {@code setNull} binds are recorded as a {@code null} value under their index, so {@code containsKey} tells a
 * bound null from a missing bind.
 */
public final class FakeJdbc {
  public final List<String> calls = new ArrayList<>();
  public final List<String> sql = new ArrayList<>();
  public final List<Map<Integer, Object>> binds = new ArrayList<>();

  public boolean autoCommit = true;
  public Function<String, List<Object[]>> rows = s -> List.of();
  public int updateCount = 1;
  /** Thrown by the next statement execution, then cleared. */
  public SQLException failure;

  public DataSource dataSource() {
    return proxy(DataSource.class, (m, args) -> {
      if (m.getName().equals("getConnection")) return connection();
      throw new UnsupportedOperationException(m.getName());
    });
  }

  public Connection connection() {
    return proxy(Connection.class, (m, args) -> switch (m.getName()) {
      case "getAutoCommit" -> autoCommit;
      case "setAutoCommit" -> {
        autoCommit = (Boolean) args[0];
        calls.add("autoCommit=" + autoCommit);
        yield null;
      }
      case "commit", "rollback", "close" -> {
        calls.add(m.getName());
        yield null;
      }
      case "isWrapperFor" -> false;
      case "createStatement" -> statement(Statement.class, null);
      case "prepareStatement" -> statement(PreparedStatement.class, (String) args[0]);
      default -> throw new UnsupportedOperationException(m.getName());
    });
  }

  private Object statement(Class<? extends Statement> type, String prepared) {
    Map<Integer, Object> bound = new LinkedHashMap<>();
    return proxy(type, (m, args) -> {
      String name = m.getName();
      if (name.startsWith("set") && args != null && args.length >= 2 && args[0] instanceof Integer pos) {
        bound.put(pos, name.equals("setNull") ? null : args[1]);
        return null;
      }
      return switch (name) {
        case "execute", "executeQuery", "executeUpdate" -> {
          String text = (args != null && args.length > 0) ? (String) args[0] : prepared;
          sql.add(text);
          binds.add(new LinkedHashMap<>(bound));
          if (failure != null) {
            SQLException f = failure;
            failure = null;
            throw f;
          }
          if (name.equals("executeQuery")) yield resultSet(rows.apply(text));
          if (name.equals("executeUpdate")) yield updateCount;
          yield true;
        }
        case "close" -> null;
        default -> throw new UnsupportedOperationException(name);
      };
    });
  }

  private ResultSet resultSet(List<Object[]> data) {
    int[] cursor = {-1};
    boolean[] lastNull = {false};
    return proxy(ResultSet.class, (m, args) -> {
      switch (m.getName()) {
        case "next" -> {
          cursor[0]++;
          return cursor[0] < data.size();
        }
        case "wasNull" -> {
          return lastNull[0];
        }
        case "close" -> {
          return null;
        }
        default -> { }
      }
      Object v = data.get(cursor[0])[(Integer) args[0] - 1];
      lastNull[0] = v == null;
      return switch (m.getName()) {
        case "getLong" -> v == null ? 0L : ((Number) v).longValue();
        case "getString" -> v == null ? null : String.valueOf(v);
        case "getTimestamp", "getObject" -> v;
        default -> throw new UnsupportedOperationException(m.getName());
      };
    });
  }

  interface Handler {
    Object invoke(Method m, Object[] args) throws Throwable;
  }

  @SuppressWarnings("unchecked")
  private static <T> T proxy(Class<T> type, Handler h) {
    return (T) Proxy.newProxyInstance(FakeJdbc.class.getClassLoader(), new Class<?>[]{type}, (p, m, args) ->
        switch (m.getName()) {
          case "toString" -> "Fake" + type.getSimpleName();
          case "hashCode" -> System.identityHashCode(p);
          case "equals" -> p == args[0];
          default -> h.invoke(m, args);
        });
  }
}
