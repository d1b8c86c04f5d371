package dev.tutordesk.book;

import dev.tutordesk.search.SearchableRecord;

/**
 * Search projection of a book block: the parent row's id, title and subject.
 *
 * @param id book id, e.g. {@code gMA001}
 * @param title book title
 * @param subject subject name
 */
public record BookRecord(String id, String title, String subject) implements SearchableRecord {

  static BookRecord from(BookRow row) {
    return new BookRecord(row.id().strip(), row.title(), row.subject());
  }
}
