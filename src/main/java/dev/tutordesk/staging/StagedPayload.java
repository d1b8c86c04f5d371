package dev.tutordesk.staging;

import java.time.Instant;

/**
 * An entry of the {@link StagingCache}: the data a preview step recorded for later confirmation.
 *
 * @param namespace namespace name the entry was stored under
 * @param token     opaque single-use token
 * @param entityId  identifier of the entity the preview was built for
 * @param payload   operation-specific data needed to perform the mutation
 * @param stagedAt  when the entry was stored (diagnostics only; never enforced)
 * @param <P>       payload type
 */
public record StagedPayload<P>(
        String namespace,
        String token,
        String entityId,
        P payload,
        Instant stagedAt
) {
}
