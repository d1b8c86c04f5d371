package dev.tutordesk.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.tutordesk.mutation.ToolResponse;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * JSON codec for the tool surface. Responses are written with snake_case property names ({@code
 * confirm_token}, {@code expires_in_seconds}); object and array arguments passed as JSON text are
 * parsed into maps and lists.
 */
@Component
public class ToolResponseWriter {

  private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper =
      JsonMapper.builder().propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE).build();

  /**
   * Serialises a response envelope.
   *
   * @throws IllegalStateException if the response cannot be serialised
   */
  public String write(ToolResponse response) {
    try {
      return mapper.writeValueAsString(response);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialise response for " + response.op(), e);
    }
  }

  /**
   * Parses a JSON object argument.
   *
   * @throws IllegalArgumentException if the text is not a JSON object
   */
  public Map<String, Object> readObject(String json) {
    try {
      return mapper.readValue(json, OBJECT_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Expected a JSON object: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Parses a JSON array argument whose elements bind to {@code elementType}.
   *
   * @throws IllegalArgumentException if the text is not such an array
   */
  public <T> List<T> readList(String json, Class<T> elementType) {
    JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, elementType);
    try {
      return mapper.readValue(json, listType);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Expected a JSON array of %s: %s"
              .formatted(elementType.getSimpleName(), e.getOriginalMessage()),
          e);
    }
  }
}
