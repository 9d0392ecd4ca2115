package io.intellixity.matviews.jdbc.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Map;

/** jsonb column helpers shared by the JDBC stores. */
final class Jsonb {
  private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};
  private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};

  private final ObjectMapper mapper;

  Jsonb(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  void bind(PreparedStatement ps, int pos, Object value) throws SQLException {
    if (value == null) {
      ps.setNull(pos, Types.OTHER);
      return;
    }
    PGobject obj = new PGobject();
    obj.setType("jsonb");
    obj.setValue(write(value));
    ps.setObject(pos, obj);
  }

  Map<String, Object> readMap(String json) {
    if (json == null) return null;
    try {
      return mapper.readValue(json, MAP);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Malformed jsonb object: " + e.getOriginalMessage(), e);
    }
  }

  List<String> readStrings(String json) {
    if (json == null) return List.of();
    try {
      return mapper.readValue(json, STRINGS);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Malformed jsonb array: " + e.getOriginalMessage(), e);
    }
  }

  private String write(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not JSON serializable: " + e.getOriginalMessage(), e);
    }
  }
}
