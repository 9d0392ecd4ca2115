package io.intellixity.matviews.response;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON for {@link ServiceResponse}: lowercase status, {@code error} omitted on success. */
public final class ServiceResponseJsonSerializer extends JsonSerializer<ServiceResponse> {
  @Override
  public void serialize(ServiceResponse r, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (r == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("status", r.status().id());
    g.writeObjectField("request", r.request());
    g.writeObjectField("response", r.response());

    ErrorDetails e = r.error();
    if (e != null) {
      g.writeObjectFieldStart("error");
      g.writeStringField("class", e.className());
      g.writeStringField("message", e.message());
      g.writeArrayFieldStart("backtrace");
      for (String line : e.backtrace()) g.writeString(line);
      g.writeEndArray();
      g.writeEndObject();
    }

    g.writeEndObject();
  }
}
