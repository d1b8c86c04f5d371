package dev.tutordesk.mcp;

import dev.tutordesk.mutation.ErrorCode;
import dev.tutordesk.mutation.ToolResponse;
import dev.tutordesk.mutation.ToolResponses;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs tool calls and writes their envelopes. Malformed JSON arguments become {@code BAD_REQUEST};
 * any other exception becomes {@code ERROR}. Nothing escapes to the MCP transport.
 */
@Component
public class ToolInvoker {

  private static final Logger log = LoggerFactory.getLogger(ToolInvoker.class);

  private final ToolResponses responses;
  private final ToolResponseWriter writer;

  public ToolInvoker(ToolResponses responses, ToolResponseWriter writer) {
    this.responses = responses;
    this.writer = writer;
  }

  String run(String op, ToolCall call) {
    ToolResponse response;
    try {
      response = call.invoke();
    } catch (InvalidArgumentException e) {
      log.debug("{}: rejected argument: {}", op, e.getMessage());
      response = responses.error(op, ErrorCode.BAD_REQUEST, e.getMessage());
    } catch (Exception e) {
      log.error("{} failed unexpectedly: {}", op, e.getMessage(), e);
      response = responses.error(op, ErrorCode.ERROR, String.valueOf(e.getMessage()));
    }
    return writer.write(response);
  }

  ToolResponse badRequest(String op, String message) {
    return responses.error(op, ErrorCode.BAD_REQUEST, message);
  }

  /** Parses an optional JSON object argument; blank text gives null. */
  @Nullable Map<String, Object> object(String name, @Nullable String json) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return writer.readObject(json);
    } catch (IllegalArgumentException e) {
      throw new InvalidArgumentException(name + ": " + e.getMessage(), e);
    }
  }

  /** Parses an optional JSON array argument; blank text gives an empty list. */
  <T> List<T> list(String name, @Nullable String json, Class<T> elementType) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return writer.readList(json, elementType);
    } catch (IllegalArgumentException e) {
      throw new InvalidArgumentException(name + ": " + e.getMessage(), e);
    }
  }

  @FunctionalInterface
  interface ToolCall {
    ToolResponse invoke();
  }

  /** A tool argument that could not be parsed. */
  static class InvalidArgumentException extends RuntimeException {

    InvalidArgumentException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
