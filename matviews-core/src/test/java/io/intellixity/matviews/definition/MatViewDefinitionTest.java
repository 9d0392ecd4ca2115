package io.intellixity.matviews.definition;

import io.intellixity.matviews.error.DefinitionValidationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MatViewDefinitionTest {
  @Test
  void acceptsIdentifierNamesOnly() {
    assertTrue(MatViewDefinition.isValidName("mv_x"));
    assertTrue(MatViewDefinition.isValidName("_Mv1"));
    assertFalse(MatViewDefinition.isValidName("1mv"));
    assertFalse(MatViewDefinition.isValidName("public.mv"));
    assertFalse(MatViewDefinition.isValidName("mv-x"));
    assertFalse(MatViewDefinition.isValidName(""));
    assertFalse(MatViewDefinition.isValidName(null));
  }

  @Test
  void selectCheckIgnoresCaseAndLeadingWhitespace() {
    assertTrue(MatViewDefinition.isSelectSql("  select 1"));
    assertTrue(MatViewDefinition.isSelectSql("SELECT id FROM t"));
    assertFalse(MatViewDefinition.isSelectSql("WITH x AS (SELECT 1) SELECT * FROM x"));
    assertFalse(MatViewDefinition.isSelectSql("DROP TABLE t"));
    assertFalse(MatViewDefinition.isSelectSql(null));
  }

  @Test
  void normalizesDefaultsAndColumns() {
    MatViewDefinition d = new MatViewDefinition(null, "mv", "SELECT 1", null,
        Arrays.asList(" id ", "id", null, "", "tenant_id"), null, "  ");
    assertEquals(RefreshStrategy.REGULAR, d.refreshStrategy());
    assertEquals(List.of("id", "tenant_id"), d.uniqueIndexColumns());
    assertEquals(List.of(), d.dependencies());
    assertNull(d.schedule());
  }

  @Test
  void validateCollectsEveryViolation() {
    MatViewDefinition d = MatViewDefinition.of("bad name", "DELETE FROM t", RefreshStrategy.CONCURRENT, List.of());
    assertEquals(List.of(
        "Invalid view name format: \"bad name\"",
        "SQL must start with SELECT",
        "refresh_strategy=concurrent requires unique_index_columns (non-empty)"), d.validate());

    DefinitionValidationException e = assertThrows(DefinitionValidationException.class, d::requireValid);
    assertEquals(3, e.violations().size());
    assertTrue(e.getMessage().contains("SQL must start with SELECT"));
  }

  @Test
  void concurrentWithColumnsIsValid() {
    MatViewDefinition d = MatViewDefinition.of("mv_x", "SELECT 1 AS id", RefreshStrategy.CONCURRENT, List.of("id"));
    assertTrue(d.validate().isEmpty());
    assertSame(d, d.requireValid());
  }

  @Test
  void strategyIdsRoundTripAndBlankMeansRegular() {
    assertEquals(RefreshStrategy.SWAP, RefreshStrategy.fromId("swap"));
    assertEquals(RefreshStrategy.CONCURRENT, RefreshStrategy.fromId(" Concurrent "));
    assertEquals(RefreshStrategy.REGULAR, RefreshStrategy.fromId(null));
    assertEquals(RefreshStrategy.REGULAR, RefreshStrategy.fromId(""));
    assertThrows(IllegalArgumentException.class, () -> RefreshStrategy.fromId("eventually"));
  }
}
