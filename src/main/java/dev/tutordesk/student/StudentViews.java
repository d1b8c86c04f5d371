package dev.tutordesk.student;

import dev.tutordesk.mutation.FieldChange;
import dev.tutordesk.search.MatchReason;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/** Response payloads of {@link StudentService} operations. */
public final class StudentViews {

  private static final Pattern SPREADSHEET_ID = Pattern.compile("[-\\w]{25,}");

  private StudentViews() {}

  /** One student; {@code plannerSheetId} falls back to the id found in the planner link. */
  public record Student(
      String id,
      String name,
      String grade,
      String status,
      String plannerSheetId,
      String plannerLink,
      String meetingDoc,
      String tags) {

    static Student from(StudentRow row) {
      String plannerSheetId = row.plannerSheetId().strip();
      if (plannerSheetId.isEmpty()) {
        plannerSheetId = spreadsheetId(row.plannerLink());
      }
      return new Student(
          row.id().strip(),
          row.name(),
          row.grade(),
          row.status(),
          plannerSheetId,
          row.plannerLink(),
          row.meetingDoc(),
          row.tags());
    }
  }

  /** Result of {@code students.list} and {@code students.filter}. */
  public record StudentList(List<Student> students, int count) {}

  /** A student matching a find query; reason is {@code exact} or {@code partial_target}. */
  public record Candidate(String studentId, String name, double score, MatchReason reason) {}

  /** Result of {@code students.find}; confidence is the top score. */
  public record SearchResult(
      String query, List<Candidate> candidates, @Nullable Candidate top, double confidence) {}

  /** Result of {@code students.get}. */
  public record Single(Student student) {}

  /** Result of {@code students.get} with several ids, in sheet order. */
  public record Many(List<Student> students) {}

  /** Result of {@code students.create}. */
  public record Created(String id, boolean created) {}

  /** Preview of {@code students.update}, keyed by field. */
  public record UpdatePreview(String studentId, Map<String, FieldChange> diffs) {}

  /** Result of a confirmed {@code students.update}. */
  public record Updated(String studentId, boolean updated, List<StudentField> fields) {}

  /** Preview of {@code students.delete}. */
  public record DeletePreview(String studentId, int row) {}

  /** Result of a confirmed {@code students.delete}. */
  public record Deleted(String studentId, boolean deleted) {}

  /** The first run of 25 or more id characters, as found in spreadsheet URLs. */
  static String spreadsheetId(String link) {
    Matcher matcher = SPREADSHEET_ID.matcher(link);
    return matcher.find() ? matcher.group() : "";
  }
}
