package io.intellixity.matviews.store;

import io.intellixity.matviews.definition.MatViewDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for {@link MatViewDefinition}s (owned by the management layer, read by jobs).
 * <p>
 * {@link #save} validates the definition and enforces name uniqueness; {@link #delete} also removes the
 * definition's runs.
 */
public interface DefinitionStore {
  /** Insert (id == null) or update; returns the stored definition with its id. */
  MatViewDefinition save(MatViewDefinition definition);

  Optional<MatViewDefinition> findById(long id);

  Optional<MatViewDefinition> findByName(String name);

  List<MatViewDefinition> findAll();

  boolean delete(long id);

  default MatViewDefinition getRequired(long id) {
    return findById(id).orElseThrow(() -> new IllegalArgumentException("Unknown definition id: " + id));
  }
}
