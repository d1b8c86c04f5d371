package dev.tutordesk.fixture;

import dev.tutordesk.search.SearchableRecord;

/** Minimal {@link SearchableRecord} for ranking tests. */
public record Doc(String id, String title, String subject) implements SearchableRecord {

  /** A chapter (detail) row: no id. */
  public static Doc detail(String title) {
    return new Doc("", title, "");
  }
}
