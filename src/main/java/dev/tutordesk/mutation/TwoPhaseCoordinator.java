package dev.tutordesk.mutation;

import dev.tutordesk.staging.StagedPayload;
import dev.tutordesk.staging.StagingCache;
import dev.tutordesk.staging.StagingNamespace;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Orchestrates preview-then-confirm mutations.
 *
 * <p>Preview: build the payload and preview view, stage the payload under a fresh token, and
 * return the token with the advisory TTL. Confirm: consume the token (exactly once), check that it
 * was issued for the same entity, then run the caller's mutation with the staged payload.
 *
 * <p>Each call touches the {@link StagingCache} at most once and never retries. A confirm whose
 * entity id does not match still consumes the token, so the caller must restart with a new
 * preview.
 */
@Component
public class TwoPhaseCoordinator {

  private static final Logger log = LoggerFactory.getLogger(TwoPhaseCoordinator.class);

  private final StagingCache stagingCache;
  private final ToolResponses responses;

  public TwoPhaseCoordinator(StagingCache stagingCache, ToolResponses responses) {
    this.stagingCache = stagingCache;
    this.responses = responses;
  }

  /**
   * Runs the preview step when {@code confirmToken} is null or blank, the confirm step otherwise.
   */
  public <P> ToolResponse execute(
      String op,
      StagingNamespace<P> namespace,
      String entityId,
      @Nullable String confirmToken,
      Supplier<PreviewDraft<P>> buildPreview,
      Function<P, ?> mutation) {
    if (confirmToken == null || confirmToken.isBlank()) {
      return preview(op, namespace, entityId, buildPreview);
    }
    return confirm(op, namespace, entityId, confirmToken, mutation);
  }

  /**
   * Builds and stages a preview.
   *
   * @return success with a {@link PreviewResponse}
   */
  public <P> ToolResponse preview(
      String op,
      StagingNamespace<P> namespace,
      String entityId,
      Supplier<PreviewDraft<P>> buildPreview) {
    PreviewDraft<P> draft = buildPreview.get();
    String token = stagingCache.store(namespace, entityId, draft.payload());
    return responses.ok(
        op, new PreviewResponse(true, draft.preview(), token, stagingCache.ttlSeconds()));
  }

  /**
   * Validates a confirm token and, if it matches {@code entityId}, applies the staged mutation.
   *
   * @return the mutation result on success; {@code CONFIRM_EXPIRED}, {@code CONFIRM_MISMATCH} or
   *     {@code ERROR} otherwise
   */
  public <P> ToolResponse confirm(
      String op,
      StagingNamespace<P> namespace,
      String entityId,
      String confirmToken,
      Function<P, ?> mutation) {
    Optional<StagedPayload<P>> staged = stagingCache.consume(namespace, confirmToken);
    if (staged.isEmpty()) {
      log.warn("{}: confirm token for entity {} is invalid or already used", op, entityId);
      return responses.error(
          op, ErrorCode.CONFIRM_EXPIRED, "confirm_token is invalid or expired");
    }

    StagedPayload<P> entry = staged.get();
    if (!entry.entityId().equals(entityId)) {
      log.warn(
          "{}: confirm token was issued for entity {} but presented for {}",
          op,
          entry.entityId(),
          entityId);
      return responses.error(
          op,
          ErrorCode.CONFIRM_MISMATCH,
          "entity id mismatch: token was issued for a different entity");
    }

    Object result;
    try {
      result = mutation.apply(entry.payload());
    } catch (RuntimeException e) {
      log.warn("{}: mutation for entity {} failed: {}", op, entityId, e.getMessage(), e);
      return responses.error(op, ErrorCode.ERROR, String.valueOf(e.getMessage()));
    }
    log.info("{}: confirmed mutation for entity {}", op, entityId);
    return responses.ok(op, result);
  }
}
