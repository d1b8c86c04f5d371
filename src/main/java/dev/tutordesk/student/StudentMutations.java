package dev.tutordesk.student;

import dev.tutordesk.staging.StagingNamespace;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Payloads staged between the preview and confirm steps of student mutations. */
final class StudentMutations {

  static final StagingNamespace<UpdatePayload> UPDATE =
      StagingNamespace.of("stu_upd", UpdatePayload.class);

  static final StagingNamespace<DeletePayload> DELETE =
      StagingNamespace.of("stu_del", DeletePayload.class);

  private StudentMutations() {}

  /** @param updates new cell values, in column order */
  record UpdatePayload(Map<StudentField, String> updates) {

    UpdatePayload {
      Map<StudentField, String> ordered = new EnumMap<>(StudentField.class);
      ordered.putAll(updates);
      updates = Collections.unmodifiableMap(ordered);
    }
  }

  /** @param previewRow sheet row of the student when the preview was issued */
  record DeletePayload(int previewRow) {}
}
