package dev.tutordesk.book;

import org.jspecify.annotations.Nullable;

/**
 * A chapter of a book, parsed from the chapter columns of a block row.
 *
 * @param idx 1-based position within the book
 * @param title chapter name, or null
 * @param range page or problem range, or null when neither bound is set
 * @param numbering how items are counted, or null
 */
public record Chapter(
    int idx, @Nullable String title, @Nullable Range range, @Nullable String numbering) {

  /** Chapter bounds; either may be null. */
  public record Range(@Nullable Integer start, @Nullable Integer end) {}
}
