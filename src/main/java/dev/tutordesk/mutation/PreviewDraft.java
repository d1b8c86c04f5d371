package dev.tutordesk.mutation;

/**
 * What a preview step produces: the payload to stage for the confirm step, and the view shown to
 * the caller.
 *
 * @param payload data staged until confirmation
 * @param preview caller-facing description of the pending change
 * @param <P> payload type
 */
public record PreviewDraft<P>(P payload, Object preview) {}
