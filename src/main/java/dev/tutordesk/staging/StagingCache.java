package dev.tutordesk.staging;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory store of single-use preview tokens.
 *
 * <p>Entries live in a {@link ConcurrentHashMap} keyed by namespace and token. {@link #consume}
 * is an atomic {@code remove}, so of two concurrent confirms presenting the same token exactly one
 * receives the payload.
 *
 * <p>The configured TTL is advisory: it is handed back to callers as metadata but entries stay
 * until consumed, cleared, or the process exits. Staged data is lost on restart.
 */
@Component
public class StagingCache {

    private static final Logger log = LoggerFactory.getLogger(StagingCache.class);

    private final ConcurrentHashMap<Key, StagedPayload<?>> entries = new ConcurrentHashMap<>();
    private final StagingProperties properties;
    private final Clock clock;

    public StagingCache(StagingProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Stage a payload under a freshly generated token.
     *
     * @param namespace operation namespace
     * @param entityId  entity the payload belongs to
     * @param payload   data to hand back on confirm
     * @return the new token
     */
    public <P> String store(StagingNamespace<P> namespace, String entityId, P payload) {
        while (true) {
            String token = UUID.randomUUID().toString();
            if (tryStore(namespace, entityId, payload, token)) {
                return token;
            }
        }
    }

    /**
     * Stage a payload under a caller-chosen token, for deterministic tests.
     *
     * @throws IllegalArgumentException if the token is already staged in this namespace
     */
    public <P> String store(
            StagingNamespace<P> namespace, String entityId, P payload, String token) {
        if (!tryStore(namespace, entityId, payload, token)) {
            throw new IllegalArgumentException(
                    "Token already staged in namespace '%s'".formatted(namespace.name()));
        }
        return token;
    }

    private <P> boolean tryStore(
            StagingNamespace<P> namespace, String entityId, P payload, String token) {
        StagedPayload<P> staged = new StagedPayload<>(
                namespace.name(), token, entityId, payload, clock.instant());
        boolean stored = entries.putIfAbsent(new Key(namespace.name(), token), staged) == null;
        if (stored) {
            log.debug("Staged {} payload for entity {}", namespace.name(), entityId);
        }
        return stored;
    }

    /**
     * Atomically retrieve and remove a staged entry.
     *
     * <p>An entry whose payload does not match the namespace's payload type is left in place.
     *
     * @return the entry, or empty if it was already consumed, never existed, or belongs to another
     *         namespace
     */
    public <P> Optional<StagedPayload<P>> consume(StagingNamespace<P> namespace, String token) {
        Key key = new Key(namespace.name(), token);
        StagedPayload<?> entry = entries.get(key);
        Optional<StagedPayload<P>> typed = typed(namespace, entry);
        // conditional remove: a concurrent consumer that got there first wins
        if (typed.isEmpty() || !entries.remove(key, entry)) {
            return Optional.empty();
        }
        return typed;
    }

    /**
     * Read a staged entry without removing it. Diagnostics only; never use before a mutation.
     */
    public <P> Optional<StagedPayload<P>> peek(StagingNamespace<P> namespace, String token) {
        return typed(namespace, entries.get(new Key(namespace.name(), token)));
    }

    /**
     * Remove every entry of a namespace.
     *
     * @return number of entries removed
     */
    public int clearNamespace(String namespace) {
        int removed = 0;
        for (Key key : entries.keySet()) {
            if (key.namespace().equals(namespace) && entries.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Remove every entry.
     *
     * @return number of entries removed
     */
    public int clearAll() {
        int removed = 0;
        for (Key key : entries.keySet()) {
            if (entries.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    /** Advisory lifetime reported to callers as {@code expires_in_seconds}. */
    public int ttlSeconds() {
        return properties.getTtlSeconds();
    }

    private static <P> Optional<StagedPayload<P>> typed(
            StagingNamespace<P> namespace, @Nullable StagedPayload<?> entry) {
        if (entry == null || !namespace.payloadType().isInstance(entry.payload())) {
            return Optional.empty();
        }
        return Optional.of(new StagedPayload<>(
                entry.namespace(),
                entry.token(),
                entry.entityId(),
                namespace.payloadType().cast(entry.payload()),
                entry.stagedAt()));
    }

    private record Key(String namespace, String token) {
    }
}
