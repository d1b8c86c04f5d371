package dev.tutordesk.book;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A book to create. The first chapter goes into the parent row, the rest into chapter rows below
 * it.
 *
 * @param idPrefix overrides the subject-derived id prefix (e.g. {@code gMA}); a missing leading
 *     {@code g} is added
 */
public record BookDraft(
    String title,
    String subject,
    @Nullable Integer unitLoad,
    @Nullable String monthlyGoal,
    List<ChapterDraft> chapters,
    @Nullable String idPrefix) {

  public BookDraft {
    chapters = chapters == null ? List.of() : List.copyOf(chapters);
  }

  /** One chapter of a new book; every part is optional. */
  public record ChapterDraft(
      @Nullable String title, Chapter.@Nullable Range range, @Nullable String numbering) {}
}
