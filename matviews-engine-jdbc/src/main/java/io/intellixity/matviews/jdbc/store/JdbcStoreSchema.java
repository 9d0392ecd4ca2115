package io.intellixity.matviews.jdbc.store;

import io.intellixity.matviews.error.MatViewsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/** Installs the {@code mat_view_definitions} / {@code mat_view_runs} tables (idempotent). */
public final class JdbcStoreSchema {
  private static final Logger log = LoggerFactory.getLogger(JdbcStoreSchema.class);

  public static final String RESOURCE = "db/matviews-schema.sql";

  private JdbcStoreSchema() {}

  public static void install(DataSource ds) {
    String script = load();
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      for (String stmt : script.split(";")) {
        if (stmt.isBlank()) continue;
        st.execute(stmt.trim());
      }
      log.info("matviews.store schema installed resource={}", RESOURCE);
    } catch (SQLException e) {
      throw new MatViewsException("Failed to install matviews schema: " + e.getMessage(), e);
    }
  }

  static String load() {
    try (InputStream in = JdbcStoreSchema.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in == null) throw new MatViewsException("Missing classpath resource " + RESOURCE);
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new MatViewsException("Failed to read " + RESOURCE, e);
    }
  }
}
