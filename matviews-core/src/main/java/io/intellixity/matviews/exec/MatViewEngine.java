package io.intellixity.matviews.exec;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.response.ServiceResponse;

/**
 * Entry point of the lifecycle engine.
 * <p>
 * Implementations never throw for operation failures: every outcome, including driver errors, comes back as
 * a {@link ServiceResponse}.
 */
public interface MatViewEngine {
  ServiceResponse create(MatViewDefinition definition, CreateOptions options);

  /** Refresh using the definition's {@link io.intellixity.matviews.definition.RefreshStrategy}. */
  ServiceResponse refresh(MatViewDefinition definition, RefreshOptions options);

  ServiceResponse delete(MatViewDefinition definition, DeleteOptions options);

  ServiceResponse exists(MatViewDefinition definition);
}
