package dev.tutordesk.student;

import dev.tutordesk.sheet.InMemoryRowStore;
import java.util.List;
import org.springframework.stereotype.Component;

/** Process-local students sheet. */
@Component
public class InMemoryStudentRowStore extends InMemoryRowStore<StudentRow, StudentField>
    implements StudentRowStore {

  public InMemoryStudentRowStore() {
    this(List.of());
  }

  public InMemoryStudentRowStore(List<StudentRow> seed) {
    super(seed);
  }

  @Override
  protected StudentRow withCell(StudentRow row, StudentField field, String value) {
    return row.with(field, value);
  }
}
