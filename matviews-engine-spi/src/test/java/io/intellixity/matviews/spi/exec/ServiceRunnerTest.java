package io.intellixity.matviews.spi.exec;

import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.response.ServiceStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ServiceRunnerTest {

  static class Recording implements MatViewService {
    final List<String> phases = new ArrayList<>();
    final Map<String, Object> request = new LinkedHashMap<>();
    final Map<String, Object> response = new LinkedHashMap<>();

    @Override public String operation() { return "recording"; }
    @Override public void assignRequest() { phases.add("assign"); request.put("k", "v"); }
    @Override public void prepare() { phases.add("prepare"); }
    @Override public ServiceResponse execute() { phases.add("execute"); return ServiceResponse.of(ServiceStatus.OK, request, response); }
    @Override public Map<String, Object> request() { return request; }
    @Override public Map<String, Object> response() { return response; }
  }

  @Test
  void runsPhasesInOrder() {
    Recording svc = new Recording();
    ServiceResponse r = ServiceRunner.run(svc);
    assertEquals(List.of("assign", "prepare", "execute"), svc.phases);
    assertEquals(ServiceStatus.OK, r.status());
  }

  @Test
  void exceptionsBecomeErrorResponsesWithPartialState() {
    Recording svc = new Recording() {
      @Override
      public ServiceResponse execute() {
        response.put("view", "public.mv");
        throw new IllegalStateException("boom");
      }
    };
    ServiceResponse r = ServiceRunner.run(svc);
    assertTrue(r.isError());
    assertEquals("boom", r.error().message());
    assertEquals(Map.of("k", "v"), r.request());
    assertEquals(Map.of("view", "public.mv"), r.response());
  }

  @Test
  void prepareFailureSkipsExecute() {
    Recording svc = new Recording() {
      @Override public void prepare() { throw new IllegalArgumentException("nope"); }
    };
    ServiceResponse r = ServiceRunner.run(svc);
    assertTrue(r.isError());
    assertEquals(List.of("assign"), svc.phases);
  }

  @Test
  void nullResponseIsAnError() {
    Recording svc = new Recording() {
      @Override public ServiceResponse execute() { return null; }
    };
    assertTrue(ServiceRunner.run(svc).isError());
  }

  @Test
  void virtualMachineErrorsPropagate() {
    Recording svc = new Recording() {
      @Override public ServiceResponse execute() { throw new OutOfMemoryError("test"); }
    };
    assertThrows(OutOfMemoryError.class, () -> ServiceRunner.run(svc));
  }
}
