package dev.tutordesk.mutation;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Envelope returned by every tool operation: {@code {ok: true, op, data}} on success, {@code {ok:
 * false, op, error}} on failure.
 *
 * @param ok whether the operation succeeded
 * @param op operation name, e.g. {@code books.update}
 * @param data operation result (success only)
 * @param error failure details (failure only)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResponse(
    boolean ok, String op, @Nullable Object data, @Nullable ToolError error) {

  /** The error code, or {@code null} for a successful response. */
  public @Nullable ErrorCode errorCode() {
    return error != null ? error.code() : null;
  }
}
