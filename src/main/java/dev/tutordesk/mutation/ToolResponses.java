package dev.tutordesk.mutation;

import org.springframework.stereotype.Component;

/**
 * Builds {@link ToolResponse} envelopes. Injected into the services and the {@link
 * TwoPhaseCoordinator} so every operation reports success and failure the same way.
 */
@Component
public class ToolResponses {

  public ToolResponse ok(String op, Object data) {
    return new ToolResponse(true, op, data, null);
  }

  public ToolResponse error(String op, ErrorCode code, String message) {
    return new ToolResponse(false, op, null, new ToolError(code, message));
  }
}
