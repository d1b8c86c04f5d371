package dev.tutordesk.book;

import dev.tutordesk.staging.StagingNamespace;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Payloads staged between the preview and confirm steps of book mutations. Row positions are not
 * staged: confirm re-locates the block, since rows shift when earlier books are deleted.
 */
final class BookMutations {

  static final StagingNamespace<UpdatePayload> UPDATE =
      StagingNamespace.of("upd", UpdatePayload.class);

  static final StagingNamespace<DeletePayload> DELETE =
      StagingNamespace.of("del", DeletePayload.class);

  private BookMutations() {}

  /** @param updates new cell values for the parent row, in field order */
  record UpdatePayload(Map<BookField, String> updates) {

    UpdatePayload {
      Map<BookField, String> ordered = new EnumMap<>(BookField.class);
      ordered.putAll(updates);
      updates = Collections.unmodifiableMap(ordered);
    }
  }

  /** @param rowCount number of rows in the block at preview time */
  record DeletePayload(int rowCount) {}
}
