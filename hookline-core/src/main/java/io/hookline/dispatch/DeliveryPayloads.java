package io.hookline.dispatch;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import io.hookline.model.EventEnvelope;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Builds the delivery body {@code {"id","type","data","created"}}.
 *
 * <p>{@code data} is the event's stored compact JSON, embedded verbatim.
 */
public final class DeliveryPayloads {
  private static final JsonFactory FACTORY = new JsonFactory();

  private DeliveryPayloads() {}

  public static String toWireJson(EventEnvelope event) {
    StringWriter out = new StringWriter(event.payloadJson().length() + 128);
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("id", event.id());
      gen.writeStringField("type", event.type());
      gen.writeFieldName("data");
      gen.writeRawValue(event.payloadJson());
      gen.writeNumberField("created", event.created());
      gen.writeEndObject();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to encode delivery payload for " + event.id(), e);
    }
    return out.toString();
  }
}
