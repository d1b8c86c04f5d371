package dev.tutordesk.book;

import dev.tutordesk.sheet.InMemoryRowStore;
import java.util.List;
import org.springframework.stereotype.Component;

/** Process-local books sheet. */
@Component
public class InMemoryBookRowStore extends InMemoryRowStore<BookRow, BookField>
    implements BookRowStore {

  public InMemoryBookRowStore() {
    this(List.of());
  }

  public InMemoryBookRowStore(List<BookRow> seed) {
    super(seed);
  }

  @Override
  protected BookRow withCell(BookRow row, BookField field, String value) {
    return row.with(field, value);
  }
}
