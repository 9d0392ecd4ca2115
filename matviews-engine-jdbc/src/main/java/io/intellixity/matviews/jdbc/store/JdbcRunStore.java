package io.intellixity.matviews.jdbc.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.matviews.error.MatViewsException;
import io.intellixity.matviews.response.ErrorDetails;
import io.intellixity.matviews.run.MatViewRun;
import io.intellixity.matviews.run.RunOperation;
import io.intellixity.matviews.run.RunStatus;
import io.intellixity.matviews.store.RunStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** {@link RunStore} over the {@code mat_view_runs} table. */
public final class JdbcRunStore implements RunStore {
  private static final String COLUMNS = "id, mat_view_definition_id, operation, status, started_at, finished_at, "
      + "duration_ms, meta::text, error::text";

  private final DataSource ds;
  private final Jsonb json;

  public JdbcRunStore(DataSource ds, ObjectMapper mapper) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.json = new Jsonb(Objects.requireNonNull(mapper, "mapper"));
  }

  @Override
  public MatViewRun create(MatViewRun run) {
    Objects.requireNonNull(run, "run");
    if (run.id() != null) throw new IllegalArgumentException("Run already persisted: " + run.id());
    String sql = "INSERT INTO mat_view_runs (mat_view_definition_id, operation, status, started_at, finished_at, "
        + "duration_ms, meta, error) VALUES (?, ?, ?, ?, ?, ?, ?, ?) RETURNING id";
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setLong(1, run.definitionId());
      bindState(ps, 2, run);
      try (ResultSet rs = ps.executeQuery()) {
        rs.next();
        return run.withId(rs.getLong(1));
      }
    } catch (SQLException e) {
      throw new MatViewsException("Failed to create run for definition " + run.definitionId() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public MatViewRun update(MatViewRun run) {
    Objects.requireNonNull(run, "run");
    if (run.id() == null) throw new IllegalArgumentException("Unknown run id: null");
    String sql = "UPDATE mat_view_runs SET operation = ?, status = ?, started_at = ?, finished_at = ?, "
        + "duration_ms = ?, meta = ?, error = ? WHERE id = ?";
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      bindState(ps, 1, run);
      ps.setLong(8, run.id());
      if (ps.executeUpdate() == 0) throw new IllegalArgumentException("Unknown run id: " + run.id());
      return run;
    } catch (SQLException e) {
      throw new MatViewsException("Failed to update run " + run.id() + ": " + e.getMessage(), e);
    }
  }

  // operation, status, started_at, finished_at, duration_ms, meta, error starting at `from`
  private void bindState(PreparedStatement ps, int from, MatViewRun run) throws SQLException {
    ps.setString(from, run.operation().id());
    ps.setString(from + 1, run.status().id());
    ps.setTimestamp(from + 2, ts(run.startedAt()));
    ps.setTimestamp(from + 3, ts(run.finishedAt()));
    if (run.durationMs() == null) ps.setNull(from + 4, Types.BIGINT);
    else ps.setLong(from + 4, run.durationMs());
    json.bind(ps, from + 5, run.meta());
    json.bind(ps, from + 6, run.error() == null ? null : run.error().toMap());
  }

  @Override
  public Optional<MatViewRun> findById(long id) {
    List<MatViewRun> found = query("SELECT " + COLUMNS + " FROM mat_view_runs WHERE id = ?", id);
    return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
  }

  @Override
  public List<MatViewRun> findByDefinition(long definitionId) {
    return query("SELECT " + COLUMNS + " FROM mat_view_runs WHERE mat_view_definition_id = ? ORDER BY id DESC",
        definitionId);
  }

  @Override
  public int deleteByDefinition(long definitionId) {
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement("DELETE FROM mat_view_runs WHERE mat_view_definition_id = ?")) {
      ps.setLong(1, definitionId);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new MatViewsException("Failed to delete runs of definition " + definitionId + ": " + e.getMessage(), e);
    }
  }

  private List<MatViewRun> query(String sql, long param) {
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setLong(1, param);
      try (ResultSet rs = ps.executeQuery()) {
        List<MatViewRun> out = new ArrayList<>();
        while (rs.next()) out.add(map(rs));
        return out;
      }
    } catch (SQLException e) {
      throw new MatViewsException("Run query failed: " + e.getMessage(), e);
    }
  }

  private MatViewRun map(ResultSet rs) throws SQLException {
    long duration = rs.getLong(7);
    Long durationMs = rs.wasNull() ? null : duration;
    return new MatViewRun(
        rs.getLong(1),
        rs.getLong(2),
        RunOperation.fromId(rs.getString(3)),
        RunStatus.fromId(rs.getString(4)),
        instant(rs.getTimestamp(5)),
        instant(rs.getTimestamp(6)),
        durationMs,
        json.readMap(rs.getString(8)),
        ErrorDetails.fromMap(json.readMap(rs.getString(9))));
  }

  private static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

  private static Instant instant(Timestamp t) { return t == null ? null : t.toInstant(); }
}
