package dev.tutordesk.student;

import dev.tutordesk.mutation.ErrorCode;
import dev.tutordesk.mutation.FieldChange;
import dev.tutordesk.mutation.PreviewDraft;
import dev.tutordesk.mutation.ToolResponse;
import dev.tutordesk.mutation.ToolResponses;
import dev.tutordesk.mutation.TwoPhaseCoordinator;
import dev.tutordesk.search.MatchReason;
import dev.tutordesk.search.SearchQuery;
import dev.tutordesk.sheet.CellText;
import dev.tutordesk.sheet.IdSequence;
import dev.tutordesk.sheet.RowFilter;
import dev.tutordesk.sheet.RowStoreException;
import dev.tutordesk.student.StudentMutations.DeletePayload;
import dev.tutordesk.student.StudentMutations.UpdatePayload;
import dev.tutordesk.student.StudentViews.Candidate;
import dev.tutordesk.student.StudentViews.Student;
import dev.tutordesk.text.TextNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Student roster operations over the students sheet: list, find, get, filter, create, and
 * two-phase update and delete.
 *
 * <p>List, find and filter see only enrolled students (status {@link
 * StudentProperties#getActiveStatus()}) unless {@code includeAll} is set. Every call reloads the
 * sheet; failures come back as {@link ToolResponse} errors.
 */
@Service
public class StudentService {

  private static final Logger log = LoggerFactory.getLogger(StudentService.class);

  static final String OP_LIST = "students.list";
  static final String OP_FIND = "students.find";
  static final String OP_GET = "students.get";
  static final String OP_FILTER = "students.filter";
  static final String OP_CREATE = "students.create";
  static final String OP_UPDATE = "students.update";
  static final String OP_DELETE = "students.delete";

  private final StudentRowStore rowStore;
  private final TwoPhaseCoordinator coordinator;
  private final ToolResponses responses;
  private final StudentProperties properties;

  public StudentService(
      StudentRowStore rowStore,
      TwoPhaseCoordinator coordinator,
      ToolResponses responses,
      StudentProperties properties) {
    this.rowStore = rowStore;
    this.coordinator = coordinator;
    this.responses = responses;
    this.properties = properties;
  }

  /** Lists students in sheet order, skipping blank rows. */
  public ToolResponse list(@Nullable Integer limit, boolean includeAll) {
    try {
      List<Student> students = new ArrayList<>();
      for (StudentRow row : rowStore.listRows()) {
        if (reachedLimit(students, limit)) {
          break;
        }
        if (!row.isBlank() && (includeAll || isActive(row))) {
          students.add(Student.from(row));
        }
      }
      return responses.ok(
          OP_LIST, new StudentViews.StudentList(List.copyOf(students), students.size()));
    } catch (RowStoreException e) {
      return storeFailure(OP_LIST, e);
    }
  }

  /**
   * Matches {@code query} against student ids and names: equality scores 1.0, a substring 0.9.
   * Candidates are ordered by score, then sheet order.
   *
   * @param limit maximum candidates; the configured default when null or below 1
   */
  public ToolResponse find(@Nullable String query, @Nullable Integer limit, boolean includeAll) {
    if (SearchQuery.isBlank(query)) {
      return responses.error(OP_FIND, ErrorCode.BAD_REQUEST, "query is required");
    }
    String wanted = TextNormalizer.normalize(query);
    int max = limit == null || limit < 1 ? properties.getFindLimit() : limit;
    try {
      List<Candidate> candidates = new ArrayList<>();
      for (StudentRow row : rowStore.listRows()) {
        if (includeAll || isActive(row)) {
          match(row, wanted).ifPresent(candidates::add);
        }
      }
      candidates.sort(Comparator.comparingDouble(Candidate::score).reversed());
      if (candidates.size() > max) {
        candidates = candidates.subList(0, max);
      }
      @Nullable Candidate top = candidates.isEmpty() ? null : candidates.get(0);
      return responses.ok(
          OP_FIND,
          new StudentViews.SearchResult(
              query, List.copyOf(candidates), top, top == null ? 0.0 : top.score()));
    } catch (RowStoreException e) {
      return storeFailure(OP_FIND, e);
    }
  }

  public ToolResponse get(@Nullable String studentId) {
    if (isBlank(studentId)) {
      return responses.error(OP_GET, ErrorCode.BAD_REQUEST, "student_id is required");
    }
    String id = studentId.strip();
    try {
      return locate(rowStore.listRows(), id)
          .map(row -> responses.ok(OP_GET, new StudentViews.Single(Student.from(row))))
          .orElseGet(() -> notFound(OP_GET, id));
    } catch (RowStoreException e) {
      return storeFailure(OP_GET, e);
    }
  }

  /** Returns several students in sheet order. Ids that match no student are skipped. */
  public ToolResponse getMany(@Nullable List<String> studentIds) {
    Set<String> wanted = new HashSet<>();
    if (studentIds != null) {
      for (String id : studentIds) {
        if (!isBlank(id)) {
          wanted.add(id.strip());
        }
      }
    }
    if (wanted.isEmpty()) {
      return responses.error(OP_GET, ErrorCode.BAD_REQUEST, "student_ids is required");
    }
    try {
      List<Student> students = new ArrayList<>();
      for (StudentRow row : rowStore.listRows()) {
        if (wanted.contains(row.id().strip())) {
          students.add(Student.from(row));
        }
      }
      return responses.ok(OP_GET, new StudentViews.Many(List.copyOf(students)));
    } catch (RowStoreException e) {
      return storeFailure(OP_GET, e);
    }
  }

  /**
   * Returns the students whose row satisfies every condition.
   *
   * @param where column name (key or sheet header) to exact value
   * @param contains column name to substring
   * @param includeAll when false and {@code where} names no status, only enrolled students match
   */
  public ToolResponse filter(
      @Nullable Map<String, ?> where,
      @Nullable Map<String, ?> contains,
      @Nullable Integer limit,
      boolean includeAll) {
    Map<String, Object> conditions = new LinkedHashMap<>();
    if (where != null) {
      conditions.putAll(where);
    }
    if (!includeAll && !namesStatus(conditions)) {
      conditions.put(StudentField.STATUS.key(), properties.getActiveStatus());
    }
    RowFilter<StudentField> filter = RowFilter.of(conditions, contains, StudentField::fromName);
    try {
      List<Student> students = new ArrayList<>();
      for (StudentRow row : rowStore.listRows()) {
        if (reachedLimit(students, limit)) {
          break;
        }
        if (!row.isBlank() && filter.matches(field -> List.of(row.valueOf(field)))) {
          students.add(Student.from(row));
        }
      }
      return responses.ok(
          OP_FILTER, new StudentViews.StudentList(List.copyOf(students), students.size()));
    } catch (RowStoreException e) {
      return storeFailure(OP_FILTER, e);
    }
  }

  /**
   * Appends a student row.
   *
   * @param record column name to value; unknown columns and any id are ignored
   * @param idPrefix id prefix; the configured one when blank
   */
  public ToolResponse create(@Nullable Map<String, ?> record, @Nullable String idPrefix) {
    String prefix = isBlank(idPrefix) ? properties.getIdPrefix() : idPrefix.strip();
    Map<StudentField, String> cells = cells(OP_CREATE, record);
    cells.remove(StudentField.ID);
    try {
      List<String> existingIds = rowStore.listRows().stream().map(StudentRow::id).toList();
      String id = IdSequence.next(prefix, existingIds);
      StudentRow row = new StudentRow(0, id, "", "", "", "", "", "", "");
      for (Map.Entry<StudentField, String> cell : cells.entrySet()) {
        row = row.with(cell.getKey(), cell.getValue());
      }
      rowStore.appendRows(List.of(row));
      log.info("{}: created student {}", OP_CREATE, id);
      return responses.ok(OP_CREATE, new StudentViews.Created(id, true));
    } catch (RowStoreException e) {
      return storeFailure(OP_CREATE, e);
    }
  }

  /**
   * Updates a student row in two phases. Without a token, previews the changed cells and returns
   * a confirm token; with a token, writes the staged values to the student's current row.
   *
   * @param updates column name to new value; required for the preview
   */
  public ToolResponse update(
      @Nullable String studentId,
      @Nullable Map<String, ?> updates,
      @Nullable String confirmToken) {
    if (isBlank(studentId)) {
      return responses.error(OP_UPDATE, ErrorCode.BAD_REQUEST, "student_id is required");
    }
    if (updates == null && isBlank(confirmToken)) {
      return responses.error(
          OP_UPDATE, ErrorCode.BAD_REQUEST, "updates is required for preview");
    }
    String id = studentId.strip();
    try {
      Optional<StudentRow> found = locate(rowStore.listRows(), id);
      if (found.isEmpty()) {
        return notFound(OP_UPDATE, id);
      }
      StudentRow row = found.get();

      return coordinator.execute(
          OP_UPDATE,
          StudentMutations.UPDATE,
          id,
          confirmToken,
          () -> previewUpdate(id, row, updates),
          payload -> {
            if (!payload.updates().isEmpty()) {
              rowStore.updateCells(row.rowNumber(), payload.updates());
            }
            return new StudentViews.Updated(id, true, List.copyOf(payload.updates().keySet()));
          });
    } catch (RowStoreException e) {
      return storeFailure(OP_UPDATE, e);
    }
  }

  /**
   * Deletes a student row in two phases. Without a token, previews the row to delete; with a
   * token, deletes the student's current row.
   */
  public ToolResponse delete(@Nullable String studentId, @Nullable String confirmToken) {
    if (isBlank(studentId)) {
      return responses.error(OP_DELETE, ErrorCode.BAD_REQUEST, "student_id is required");
    }
    String id = studentId.strip();
    try {
      Optional<StudentRow> found = locate(rowStore.listRows(), id);
      if (found.isEmpty()) {
        return notFound(OP_DELETE, id);
      }
      StudentRow row = found.get();

      return coordinator.execute(
          OP_DELETE,
          StudentMutations.DELETE,
          id,
          confirmToken,
          () ->
              new PreviewDraft<>(
                  new DeletePayload(row.rowNumber()),
                  new StudentViews.DeletePreview(id, row.rowNumber())),
          payload -> {
            if (payload.previewRow() != row.rowNumber()) {
              log.debug(
                  "{}: student {} moved from row {} to {} since preview",
                  OP_DELETE,
                  id,
                  payload.previewRow(),
                  row.rowNumber());
            }
            rowStore.deleteRows(row.rowNumber(), 1);
            return new StudentViews.Deleted(id, true);
          });
    } catch (RowStoreException e) {
      return storeFailure(OP_DELETE, e);
    }
  }

  private PreviewDraft<UpdatePayload> previewUpdate(
      String studentId, StudentRow row, @Nullable Map<String, ?> updates) {
    Map<StudentField, String> accepted = cells(OP_UPDATE, updates);
    Map<String, FieldChange> diffs = new LinkedHashMap<>();
    for (Map.Entry<StudentField, String> entry : accepted.entrySet()) {
      String from = row.valueOf(entry.getKey());
      if (!from.equals(entry.getValue())) {
        diffs.put(entry.getKey().key(), new FieldChange(from, entry.getValue()));
      }
    }
    return new PreviewDraft<>(
        new UpdatePayload(accepted), new StudentViews.UpdatePreview(studentId, diffs));
  }

  /** Maps caller column names to fields; unknown names are dropped. */
  private static Map<StudentField, String> cells(String op, @Nullable Map<String, ?> values) {
    Map<StudentField, String> cells = new EnumMap<>(StudentField.class);
    if (values == null) {
      return cells;
    }
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      Optional<StudentField> field = StudentField.fromName(entry.getKey());
      if (field.isPresent()) {
        cells.put(field.get(), CellText.of(entry.getValue()));
      } else {
        log.debug("{}: ignoring unknown column '{}'", op, entry.getKey());
      }
    }
    return cells;
  }

  private static Optional<Candidate> match(StudentRow row, String wanted) {
    String id = row.id().strip();
    String name = row.name().strip();
    if (id.isEmpty() && name.isEmpty()) {
      return Optional.empty();
    }
    String normalizedId = TextNormalizer.normalize(id);
    String normalizedName = TextNormalizer.normalize(name);
    MatchReason reason;
    if (normalizedId.equals(wanted) || normalizedName.equals(wanted)) {
      reason = MatchReason.EXACT;
    } else if (normalizedId.contains(wanted) || normalizedName.contains(wanted)) {
      reason = MatchReason.PARTIAL_TARGET;
    } else {
      return Optional.empty();
    }
    return Optional.of(new Candidate(id, name, reason.baseScore(), reason));
  }

  private boolean isActive(StudentRow row) {
    return TextNormalizer.normalize(row.status())
        .equals(TextNormalizer.normalize(properties.getActiveStatus()));
  }

  private static boolean namesStatus(Map<String, ?> where) {
    return where.keySet().stream()
        .anyMatch(key -> StudentField.fromName(key).orElse(null) == StudentField.STATUS);
  }

  private static Optional<StudentRow> locate(List<StudentRow> rows, String studentId) {
    return rows.stream().filter(row -> row.id().strip().equals(studentId)).findFirst();
  }

  private static boolean reachedLimit(List<?> results, @Nullable Integer limit) {
    return limit != null && limit > 0 && results.size() >= limit;
  }

  private static boolean isBlank(@Nullable String value) {
    return value == null || value.isBlank();
  }

  private ToolResponse notFound(String op, String studentId) {
    return responses.error(
        op, ErrorCode.NOT_FOUND, "student_id '%s' not found".formatted(studentId));
  }

  private ToolResponse storeFailure(String op, RowStoreException e) {
    log.warn("{}: row store failure: {}", op, e.getMessage(), e);
    return responses.error(op, ErrorCode.ERROR, String.valueOf(e.getMessage()));
  }
}
