package io.intellixity.matviews.error;

import java.util.List;

/** Raised when a definition (name, SQL, strategy/columns) fails validation. Never reaches the database. */
public final class DefinitionValidationException extends MatViewsException {
  private final List<String> violations;

  public DefinitionValidationException(String message) {
    this(List.of(message));
  }

  public DefinitionValidationException(List<String> violations) {
    super(String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }

  public List<String> violations() { return violations; }
}
