package dev.tutordesk.student;

import com.fasterxml.jackson.annotation.JsonValue;
import dev.tutordesk.text.TextNormalizer;
import java.util.List;
import java.util.Optional;

/**
 * Columns of the students sheet. Callers name a column by its key or by one of the sheet headers
 * it appears under; names are compared after {@link TextNormalizer#normalizeKey}.
 */
public enum StudentField {
  ID("id", "生徒ID"),
  NAME("name", "名前", "氏名", "生徒名"),
  GRADE("grade", "学年"),
  STATUS("status", "ステータス", "在籍状況"),
  PLANNER_LINK(
      "planner_link", "スプレッドシート", "スピードプランナー", "PlannerLink", "プランナーリンク", "スプレッドシートURL"),
  PLANNER_SHEET_ID("planner_sheet_id", "スピードプランナーID", "PlannerSheetId", "プランナーID"),
  MEETING_DOC("meeting_doc", "ドキュメント", "面談メモID", "MeetingDocId", "meeting_doc_id"),
  TAGS("tags", "タグ");

  private final String key;
  private final List<String> headers;

  StudentField(String key, String... headers) {
    this.key = key;
    this.headers = List.of(headers);
  }

  @JsonValue
  public String key() {
    return key;
  }

  public static Optional<StudentField> fromName(String name) {
    String wanted = TextNormalizer.normalizeKey(name);
    for (StudentField field : values()) {
      if (field.key.equals(wanted)) {
        return Optional.of(field);
      }
      for (String header : field.headers) {
        if (TextNormalizer.normalizeKey(header).equals(wanted)) {
          return Optional.of(field);
        }
      }
    }
    return Optional.empty();
  }
}
