package dev.tutordesk.mcp;

import dev.tutordesk.student.StudentService;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the student roster. List, find and filter return enrolled students only
 * unless {@code includeAll} is true. Update and delete are two-phase, as for books.
 *
 * @see BookToolService
 */
@Service
public class StudentToolService {

  private final StudentService studentService;
  private final ToolInvoker invoker;

  public StudentToolService(StudentService studentService, ToolInvoker invoker) {
    this.studentService = studentService;
    this.invoker = invoker;
  }

  @Tool(
      name = "students_list",
      description = "List enrolled students (ID, name, grade, status, planner and meeting links).")
  public String listStudents(
      @ToolParam(description = "Maximum number of students to return", required = false)
          @Nullable Integer limit,
      @ToolParam(description = "Include students who are not enrolled", required = false)
          @Nullable Boolean includeAll) {
    return invoker.run("students.list", () -> studentService.list(limit, isTrue(includeAll)));
  }

  @Tool(
      name = "students_find",
      description =
          "Find students by name or student ID. Exact matches score 1.0, partial matches 0.9.")
  public String findStudents(
      @ToolParam(description = "Name or ID, or part of one") @Nullable String query,
      @ToolParam(description = "Maximum number of candidates (default 10)", required = false)
          @Nullable Integer limit,
      @ToolParam(description = "Include students who are not enrolled", required = false)
          @Nullable Boolean includeAll) {
    return invoker.run(
        "students.find", () -> studentService.find(query, limit, isTrue(includeAll)));
  }

  @Tool(
      name = "students_get",
      description = "Get students by ID. Pass studentId for one student or studentIds for several.")
  public String getStudent(
      @ToolParam(description = "Student ID, e.g. s001", required = false) @Nullable
          String studentId,
      @ToolParam(description = "Several student IDs; takes precedence", required = false)
          @Nullable List<String> studentIds) {
    return invoker.run(
        "students.get",
        () -> {
          if (studentIds != null && !studentIds.isEmpty()) {
            return studentService.getMany(studentIds);
          }
          if (studentId == null || studentId.isBlank()) {
            return invoker.badRequest("students.get", "student_id or student_ids is required");
          }
          return studentService.get(studentId);
        });
  }

  @Tool(
      name = "students_filter",
      description =
          "Filter students by column values. 'where' requires an exact match and 'contains' "
              + "a substring. Columns: id, name, grade, status, planner_link, "
              + "planner_sheet_id, meeting_doc, tags (or their sheet headers, e.g. 名前, 学年).")
  public String filterStudents(
      @ToolParam(description = "JSON object of column to exact value", required = false)
          @Nullable String where,
      @ToolParam(description = "JSON object of column to substring", required = false)
          @Nullable String contains,
      @ToolParam(description = "Maximum number of students to return", required = false)
          @Nullable Integer limit,
      @ToolParam(
              description =
                  "Include students who are not enrolled; ignored when 'where' names a status",
              required = false)
          @Nullable Boolean includeAll) {
    return invoker.run(
        "students.filter",
        () ->
            studentService.filter(
                invoker.object("where", where),
                invoker.object("contains", contains),
                limit,
                isTrue(includeAll)));
  }

  @Tool(
      name = "students_create",
      description =
          "Create a student. The record maps column names to values, e.g. "
              + "{\"名前\": \"山田太郎\", \"学年\": \"高1\"}. The ID is generated (s001, s002, ...).")
  public String createStudent(
      @ToolParam(description = "JSON object of column to value") @Nullable String record,
      @ToolParam(description = "ID prefix (default s)", required = false) @Nullable
          String idPrefix) {
    return invoker.run(
        "students.create",
        () -> studentService.create(invoker.object("record", record), idPrefix));
  }

  @Tool(
      name = "students_update",
      description =
          "Update a student's columns. Call without confirmToken to preview the changes and "
              + "receive a token; call again with the same studentId and the token to apply them.")
  public String updateStudent(
      @ToolParam(description = "Student ID to update") @Nullable String studentId,
      @ToolParam(
              description = "JSON object of column to new value. Required for preview.",
              required = false)
          @Nullable String updates,
      @ToolParam(description = "Token returned by the preview call", required = false)
          @Nullable String confirmToken) {
    return invoker.run(
        "students.update",
        () -> {
          if (confirmToken != null && !confirmToken.isBlank()) {
            return studentService.update(studentId, null, confirmToken);
          }
          Map<String, Object> parsed = invoker.object("updates", updates);
          return studentService.update(studentId, parsed, null);
        });
  }

  @Tool(
      name = "students_delete",
      description =
          "Delete a student row. Call without confirmToken to preview and receive a token; "
              + "call again with the same studentId and the token to delete.")
  public String deleteStudent(
      @ToolParam(description = "Student ID to delete") @Nullable String studentId,
      @ToolParam(description = "Token returned by the preview call", required = false)
          @Nullable String confirmToken) {
    return invoker.run(
        "students.delete", () -> studentService.delete(studentId, confirmToken));
  }

  private static boolean isTrue(@Nullable Boolean flag) {
    return Boolean.TRUE.equals(flag);
  }
}
