package io.intellixity.matviews.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ServiceResponseTest {
  @Test
  void successStatusesCarryNoError() {
    for (ServiceStatus s : ServiceStatus.values()) {
      if (s == ServiceStatus.ERROR) continue;
      ServiceResponse r = ServiceResponse.of(s, Map.of("force", false), Map.of("view", "public.mv"));
      assertTrue(r.isSuccess(), s.id());
      assertFalse(r.isError());
      assertNull(r.error());
      assertFalse(r.toMap().containsKey("error"));
    }
  }

  @Test
  void rejectsMismatchedStatusAndError() {
    ErrorDetails err = new ErrorDetails("x.Boom", "boom", List.of());
    assertThrows(IllegalArgumentException.class, () -> new ServiceResponse(ServiceStatus.ERROR, Map.of(), Map.of(), null));
    assertThrows(IllegalArgumentException.class, () -> new ServiceResponse(ServiceStatus.OK, Map.of(), Map.of(), err));
    assertThrows(IllegalArgumentException.class, () -> new ServiceResponse(null, Map.of(), Map.of(), null));
  }

  @Test
  void errorFromThrowableCapturesClassMessageAndBacktrace() {
    IllegalStateException boom = new IllegalStateException("boom");
    ServiceResponse r = ServiceResponse.error(boom, Map.of("row_count_strategy", "none"), Map.of());

    assertTrue(r.isError());
    assertFalse(r.isSuccess());
    assertEquals("java.lang.IllegalStateException", r.error().className());
    assertEquals("boom", r.error().message());
    assertFalse(r.error().backtrace().isEmpty());

    @SuppressWarnings("unchecked")
    Map<String, Object> error = (Map<String, Object>) r.toMap().get("error");
    assertEquals("boom", error.get("message"));
    assertEquals("error", r.toMap().get("status"));
  }

  @Test
  void mapsAreCopiedAndAllowNullValues() {
    Map<String, Object> resp = new LinkedHashMap<>();
    resp.put("view", "public.mv");
    resp.put("sql", null);
    ServiceResponse r = ServiceResponse.of(ServiceStatus.SKIPPED, null, resp);
    resp.put("late", 1);

    assertEquals(Map.of(), r.request());
    assertTrue(r.response().containsKey("sql"));
    assertFalse(r.response().containsKey("late"));
    assertThrows(UnsupportedOperationException.class, () -> r.response().put("x", 1));
  }

  @Test
  void metaHoldsRequestAndResponse() {
    ServiceResponse r = ServiceResponse.of(ServiceStatus.UPDATED, Map.of("a", 1), Map.of("b", 2));
    assertEquals(Map.of("request", Map.of("a", 1), "response", Map.of("b", 2)), r.meta());
  }

  @Test
  void serializesToCanonicalJson() throws Exception {
    ObjectMapper mapper = new ObjectMapper();

    JsonNode ok = mapper.readTree(mapper.writeValueAsString(
        ServiceResponse.of(ServiceStatus.CREATED, Map.of("force", true), Map.of("view", "public.mv"))));
    assertEquals("created", ok.get("status").asText());
    assertTrue(ok.get("request").get("force").asBoolean());
    assertEquals("public.mv", ok.get("response").get("view").asText());
    assertFalse(ok.has("error"));

    JsonNode err = mapper.readTree(mapper.writeValueAsString(
        ServiceResponse.error(new RuntimeException("nope"), Map.of(), Map.of())));
    assertEquals("error", err.get("status").asText());
    assertEquals("java.lang.RuntimeException", err.get("error").get("class").asText());
    assertEquals("nope", err.get("error").get("message").asText());
    assertTrue(err.get("error").get("backtrace").isArray());
  }

  @Test
  void errorDetailsSurviveMapForm() {
    ErrorDetails d = new ErrorDetails("a.B", "msg", List.of("a.B.c(B.java:1)"));
    assertEquals(d, ErrorDetails.fromMap(d.toMap()));
    assertNull(ErrorDetails.fromMap(null));
  }
}
