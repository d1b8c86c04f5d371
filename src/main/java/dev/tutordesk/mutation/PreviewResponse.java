package dev.tutordesk.mutation;

/**
 * Data of a successful preview step.
 *
 * @param requiresConfirmation always {@code true}
 * @param preview caller-facing description of the pending change
 * @param confirmToken single-use token to present on confirm
 * @param expiresInSeconds advisory token lifetime
 */
public record PreviewResponse(
    boolean requiresConfirmation, Object preview, String confirmToken, int expiresInSeconds) {}
