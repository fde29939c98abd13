package ca.gc.cra.diagsink.infrastructure.events;

import ca.gc.cra.diagsink.domain.event.LatencyEvent;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.Objects;

/**
 * Decodes latency events from {@code {"latency": ..., "diagnostics": ...}} JSON objects.
 * <p>Scalar values are taken as text, so numeric latencies keep their original rendering. Unknown
 * fields are skipped. A document without a {@code latency} field is rejected.</p>
 */
final class LatencyEventJson {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses one JSON document.
   *
   * @param json document text; must not be {@code null}
   * @return decoded event
   * @throws IllegalArgumentException when the document is not a valid latency event
   */
  LatencyEvent decode(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("latency event must be a JSON object");
      }
      String latency = null;
      String diagnostics = null;
      while (true) {
        JsonToken token = parser.nextToken();
        if (token == JsonToken.END_OBJECT) {
          break;
        }
        if (token != JsonToken.FIELD_NAME) {
          throw new IllegalArgumentException("Unexpected JSON token: " + token);
        }
        String field = parser.currentName();
        JsonToken value = parser.nextToken();
        if ("latency".equals(field)) {
          latency = scalar(parser, value, field);
        } else if ("diagnostics".equals(field)) {
          diagnostics = scalar(parser, value, field);
        } else {
          parser.skipChildren();
        }
      }
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      if (latency == null) {
        throw new IllegalArgumentException("Missing field latency");
      }
      return new LatencyEvent(latency, diagnostics);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  private static String scalar(JsonParser parser, JsonToken token, String field) throws IOException {
    if (token == JsonToken.VALUE_NULL) {
      return "";
    }
    if (token == null || !token.isScalarValue()) {
      throw new IllegalArgumentException("Field " + field + " must be a scalar");
    }
    return parser.getText();
  }
}
