package io.intellixity.matviews.store;

import io.intellixity.matviews.definition.MatViewDefinition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simple in-memory {@link DefinitionStore}.\n
 *
 * Useful for tests, demos and single-process setups.\n
 */
public final class InMemoryDefinitionStore implements DefinitionStore {
  private final Map<Long, MatViewDefinition> byId = new ConcurrentHashMap<>();
  private final AtomicLong seq = new AtomicLong();
  private final RunStore runs;

  public InMemoryDefinitionStore() {
    this(null);
  }

  /** @param runs run store to cascade deletes into (may be null) */
  public InMemoryDefinitionStore(RunStore runs) {
    this.runs = runs;
  }

  @Override
  public synchronized MatViewDefinition save(MatViewDefinition definition) {
    Objects.requireNonNull(definition, "definition").requireValid();
    findByName(definition.name())
        .filter(existing -> !existing.id().equals(definition.id()))
        .ifPresent(existing -> {
          throw new IllegalArgumentException("Definition name already taken: " + definition.name());
        });

    MatViewDefinition stored = (definition.id() == null) ? definition.withId(seq.incrementAndGet()) : definition;
    if (definition.id() != null && !byId.containsKey(definition.id())) {
      throw new IllegalArgumentException("Unknown definition id: " + definition.id());
    }
    byId.put(stored.id(), stored);
    return stored;
  }

  @Override
  public Optional<MatViewDefinition> findById(long id) {
    return Optional.ofNullable(byId.get(id));
  }

  @Override
  public Optional<MatViewDefinition> findByName(String name) {
    if (name == null) return Optional.empty();
    return byId.values().stream().filter(d -> name.equals(d.name())).findFirst();
  }

  @Override
  public List<MatViewDefinition> findAll() {
    List<MatViewDefinition> out = new ArrayList<>(byId.values());
    out.sort(Comparator.comparing(MatViewDefinition::name));
    return out;
  }

  @Override
  public boolean delete(long id) {
    MatViewDefinition removed = byId.remove(id);
    if (removed == null) return false;
    if (runs != null) runs.deleteByDefinition(id);
    return true;
  }
}
