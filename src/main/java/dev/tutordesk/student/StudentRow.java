package dev.tutordesk.student;

import dev.tutordesk.sheet.SheetRow;
import org.jspecify.annotations.Nullable;

/**
 * One row of the students sheet as delivered by the {@link StudentRowStore}. Empty cells are empty
 * strings.
 *
 * @param rowNumber 1-based sheet row number (row 1 is the header)
 * @param plannerLink URL of the student's study-planner spreadsheet
 * @param plannerSheetId spreadsheet id of the planner; often left blank and derived from the link
 */
public record StudentRow(
    int rowNumber,
    String id,
    String name,
    String grade,
    String status,
    String plannerLink,
    String plannerSheetId,
    String meetingDoc,
    String tags)
    implements SheetRow<StudentRow> {

  public StudentRow {
    id = blankIfNull(id);
    name = blankIfNull(name);
    grade = blankIfNull(grade);
    status = blankIfNull(status);
    plannerLink = blankIfNull(plannerLink);
    plannerSheetId = blankIfNull(plannerSheetId);
    meetingDoc = blankIfNull(meetingDoc);
    tags = blankIfNull(tags);
  }

  /** Whether every cell is blank. */
  public boolean isBlank() {
    for (StudentField field : StudentField.values()) {
      if (!valueOf(field).isBlank()) {
        return false;
      }
    }
    return true;
  }

  public String valueOf(StudentField field) {
    return switch (field) {
      case ID -> id;
      case NAME -> name;
      case GRADE -> grade;
      case STATUS -> status;
      case PLANNER_LINK -> plannerLink;
      case PLANNER_SHEET_ID -> plannerSheetId;
      case MEETING_DOC -> meetingDoc;
      case TAGS -> tags;
    };
  }

  /** Copy with one cell replaced. */
  public StudentRow with(StudentField field, String value) {
    return new StudentRow(
        rowNumber,
        field == StudentField.ID ? value : id,
        field == StudentField.NAME ? value : name,
        field == StudentField.GRADE ? value : grade,
        field == StudentField.STATUS ? value : status,
        field == StudentField.PLANNER_LINK ? value : plannerLink,
        field == StudentField.PLANNER_SHEET_ID ? value : plannerSheetId,
        field == StudentField.MEETING_DOC ? value : meetingDoc,
        field == StudentField.TAGS ? value : tags);
  }

  @Override
  public StudentRow atRow(int newRowNumber) {
    return new StudentRow(
        newRowNumber, id, name, grade, status, plannerLink, plannerSheetId, meetingDoc, tags);
  }

  private static String blankIfNull(@Nullable String value) {
    return value == null ? "" : value;
  }
}
