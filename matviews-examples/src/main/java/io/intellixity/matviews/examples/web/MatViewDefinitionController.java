package io.intellixity.matviews.examples.web;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.definition.RefreshStrategy;
import io.intellixity.matviews.error.DefinitionValidationException;
import io.intellixity.matviews.examples.service.MatViewAdminService;
import io.intellixity.matviews.exec.RowCountStrategy;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.run.MatViewRun;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/mat-views")
public final class MatViewDefinitionController {
  private final MatViewAdminService admin;

  public MatViewDefinitionController(MatViewAdminService admin) {
    this.admin = admin;
  }

  public record DefinitionRequest(String name, String sql, String refreshStrategy,
                                  List<String> uniqueIndexColumns, List<String> dependencies, String schedule) {}

  @PostMapping
  public MatViewDefinition define(@RequestBody DefinitionRequest req) {
    return admin.save(new MatViewDefinition(null, req.name, req.sql, RefreshStrategy.fromId(req.refreshStrategy),
        req.uniqueIndexColumns, req.dependencies, req.schedule));
  }

  @GetMapping
  public List<MatViewDefinition> list() {
    return admin.list();
  }

  @GetMapping("/{id}")
  public ResponseEntity<MatViewDefinition> get(@PathVariable("id") long id) {
    return admin.get(id).map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
  }

  @GetMapping("/{id}/exists")
  public ServiceResponse exists(@PathVariable("id") long id) {
    return admin.exists(id);
  }

  @PostMapping("/{id}/create")
  public ResponseEntity<Void> create(@PathVariable("id") long id,
                                     @RequestParam(name = "force", defaultValue = "false") boolean force) {
    admin.create(id, force);
    return ResponseEntity.accepted().build();
  }

  @PostMapping("/{id}/refresh")
  public ResponseEntity<Void> refresh(@PathVariable("id") long id,
                                      @RequestParam(name = "rowCountStrategy", defaultValue = "estimated") String strategy) {
    admin.refresh(id, RowCountStrategy.from(strategy));
    return ResponseEntity.accepted().build();
  }

  @PostMapping("/{id}/delete")
  public ResponseEntity<Void> delete(@PathVariable("id") long id,
                                     @RequestParam(name = "cascade", defaultValue = "false") boolean cascade) {
    admin.delete(id, cascade);
    return ResponseEntity.accepted().build();
  }

  @GetMapping("/{id}/runs")
  public List<MatViewRun> runs(@PathVariable("id") long id) {
    return admin.runs(id);
  }

  @ExceptionHandler(DefinitionValidationException.class)
  public ResponseEntity<Map<String, Object>> invalid(DefinitionValidationException e) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("errors", e.violations()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
  }
}
