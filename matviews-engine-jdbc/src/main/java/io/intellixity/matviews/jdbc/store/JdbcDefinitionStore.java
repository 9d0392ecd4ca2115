package io.intellixity.matviews.jdbc.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.definition.RefreshStrategy;
import io.intellixity.matviews.error.MatViewsException;
import io.intellixity.matviews.store.DefinitionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link DefinitionStore} over the {@code mat_view_definitions} table.
 * <p>
 * Name uniqueness is enforced by the table's unique constraint; runs are removed by {@code ON DELETE CASCADE}.
 */
public final class JdbcDefinitionStore implements DefinitionStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcDefinitionStore.class);

  private static final String COLUMNS =
      "id, name, sql, refresh_strategy, unique_index_columns::text, dependencies::text, schedule";
  private static final String UNIQUE_VIOLATION = "23505";

  private final DataSource ds;
  private final Jsonb json;

  public JdbcDefinitionStore(DataSource ds, ObjectMapper mapper) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.json = new Jsonb(Objects.requireNonNull(mapper, "mapper"));
  }

  @Override
  public MatViewDefinition save(MatViewDefinition definition) {
    Objects.requireNonNull(definition, "definition").requireValid();
    return (definition.id() == null) ? insert(definition) : update(definition);
  }

  private MatViewDefinition insert(MatViewDefinition d) {
    String sql = "INSERT INTO mat_view_definitions "
        + "(name, sql, refresh_strategy, unique_index_columns, dependencies, schedule) "
        + "VALUES (?, ?, ?, ?, ?, ?) RETURNING id";
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      bindFields(ps, d);
      try (ResultSet rs = ps.executeQuery()) {
        rs.next();
        MatViewDefinition stored = d.withId(rs.getLong(1));
        log.debug("matviews.store op=insert_definition id={} name={}", stored.id(), stored.name());
        return stored;
      }
    } catch (SQLException e) {
      throw translate(e, d);
    }
  }

  private MatViewDefinition update(MatViewDefinition d) {
    String sql = "UPDATE mat_view_definitions SET name = ?, sql = ?, refresh_strategy = ?, "
        + "unique_index_columns = ?, dependencies = ?, schedule = ?, updated_at = now() WHERE id = ?";
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      bindFields(ps, d);
      ps.setLong(7, d.id());
      if (ps.executeUpdate() == 0) throw new IllegalArgumentException("Unknown definition id: " + d.id());
      log.debug("matviews.store op=update_definition id={} name={}", d.id(), d.name());
      return d;
    } catch (SQLException e) {
      throw translate(e, d);
    }
  }

  private void bindFields(PreparedStatement ps, MatViewDefinition d) throws SQLException {
    ps.setString(1, d.name());
    ps.setString(2, d.sql());
    ps.setString(3, d.refreshStrategy().id());
    json.bind(ps, 4, d.uniqueIndexColumns());
    json.bind(ps, 5, d.dependencies());
    ps.setString(6, d.schedule());
  }

  @Override
  public Optional<MatViewDefinition> findById(long id) {
    List<MatViewDefinition> found = query("SELECT " + COLUMNS + " FROM mat_view_definitions WHERE id = ?", id);
    return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
  }

  @Override
  public Optional<MatViewDefinition> findByName(String name) {
    if (name == null) return Optional.empty();
    List<MatViewDefinition> found = query("SELECT " + COLUMNS + " FROM mat_view_definitions WHERE name = ?", name);
    return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
  }

  @Override
  public List<MatViewDefinition> findAll() {
    return query("SELECT " + COLUMNS + " FROM mat_view_definitions ORDER BY name");
  }

  @Override
  public boolean delete(long id) {
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement("DELETE FROM mat_view_definitions WHERE id = ?")) {
      ps.setLong(1, id);
      return ps.executeUpdate() > 0;
    } catch (SQLException e) {
      throw new MatViewsException("Failed to delete definition " + id + ": " + e.getMessage(), e);
    }
  }

  private List<MatViewDefinition> query(String sql, Object... params) {
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      for (int i = 0; i < params.length; i++) ps.setObject(i + 1, params[i]);
      try (ResultSet rs = ps.executeQuery()) {
        List<MatViewDefinition> out = new ArrayList<>();
        while (rs.next()) out.add(map(rs));
        return out;
      }
    } catch (SQLException e) {
      throw new MatViewsException("Definition query failed: " + e.getMessage(), e);
    }
  }

  private MatViewDefinition map(ResultSet rs) throws SQLException {
    return new MatViewDefinition(
        rs.getLong(1),
        rs.getString(2),
        rs.getString(3),
        RefreshStrategy.fromId(rs.getString(4)),
        json.readStrings(rs.getString(5)),
        json.readStrings(rs.getString(6)),
        rs.getString(7));
  }

  private static RuntimeException translate(SQLException e, MatViewDefinition d) {
    if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
      return new IllegalArgumentException("Definition name already taken: " + d.name(), e);
    }
    return new MatViewsException("Failed to save definition " + d.name() + ": " + e.getMessage(), e);
  }
}
