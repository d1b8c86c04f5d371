package dev.tutordesk.mutation;

/**
 * Error body of a failed {@link ToolResponse}.
 *
 * @param code machine-readable error code
 * @param message human-readable explanation
 */
public record ToolError(ErrorCode code, String message) {}
