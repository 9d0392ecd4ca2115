package io.intellixity.matviews.examples.service;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.exec.MatViewEngine;
import io.intellixity.matviews.exec.RowCountStrategy;
import io.intellixity.matviews.jobs.MatViewJobs;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.run.MatViewRun;
import io.intellixity.matviews.store.DefinitionStore;
import io.intellixity.matviews.store.RunStore;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public final class MatViewAdminService {
  private final DefinitionStore definitions;
  private final RunStore runs;
  private final MatViewEngine engine;
  private final MatViewJobs jobs;

  public MatViewAdminService(DefinitionStore definitions, RunStore runs, MatViewEngine engine, MatViewJobs jobs) {
    this.definitions = definitions;
    this.runs = runs;
    this.engine = engine;
    this.jobs = jobs;
  }

  public MatViewDefinition save(MatViewDefinition definition) {
    return definitions.save(definition);
  }

  public List<MatViewDefinition> list() {
    return definitions.findAll();
  }

  public Optional<MatViewDefinition> get(long id) {
    return definitions.findById(id);
  }

  public ServiceResponse exists(long id) {
    return engine.exists(definitions.getRequired(id));
  }

  public void create(long id, boolean force) {
    jobs.enqueueCreate(definitions.getRequired(id).id(), force);
  }

  public void refresh(long id, RowCountStrategy rowCountStrategy) {
    jobs.enqueueRefresh(definitions.getRequired(id).id(), rowCountStrategy);
  }

  public void delete(long id, boolean cascade) {
    jobs.enqueueDelete(definitions.getRequired(id).id(), cascade, null);
  }

  public List<MatViewRun> runs(long id) {
    return runs.findByDefinition(id);
  }
}
