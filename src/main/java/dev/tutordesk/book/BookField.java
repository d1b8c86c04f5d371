package dev.tutordesk.book;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/** Book metadata fields that an update may change. */
public enum BookField {
  TITLE("title"),
  SUBJECT("subject"),
  MONTHLY_GOAL("monthly_goal"),
  UNIT_LOAD("unit_load");

  private final String key;

  BookField(String key) {
    this.key = key;
  }

  /** The argument name callers use for this field. */
  @JsonValue
  public String key() {
    return key;
  }

  public static Optional<BookField> fromKey(String key) {
    for (BookField field : values()) {
      if (field.key.equals(key)) {
        return Optional.of(field);
      }
    }
    return Optional.empty();
  }
}
