package dev.tutordesk.staging;

/**
 * Typed partition of the {@link StagingCache}. The namespace name isolates tokens of different
 * operations ({@code upd}, {@code del}); the payload type lets consumers read staged data without
 * unchecked casts.
 *
 * @param name        key prefix, unique per payload type
 * @param payloadType class of the payloads staged under this namespace
 * @param <P>         payload type
 */
public record StagingNamespace<P>(String name, Class<P> payloadType) {

    public StagingNamespace {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Namespace name must not be blank");
        }
        if (payloadType == null) {
            throw new IllegalArgumentException("Namespace payload type must not be null");
        }
    }

    public static <P> StagingNamespace<P> of(String name, Class<P> payloadType) {
        return new StagingNamespace<>(name, payloadType);
    }
}
