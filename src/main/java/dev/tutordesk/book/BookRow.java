package dev.tutordesk.book;

import dev.tutordesk.sheet.SheetRow;
import org.jspecify.annotations.Nullable;

/**
 * One row of the books sheet as delivered by the {@link BookRowStore}. Cells are raw strings;
 * empty cells are empty strings.
 *
 * <p>A row with an id starts a book block and carries the book metadata. Rows without an id that
 * follow it are chapter rows of the same book. Either kind may carry chapter columns.
 *
 * @param rowNumber 1-based sheet row number (row 1 is the header)
 * @param numbering how items inside a chapter are counted, e.g. {@code 問} or {@code No.}
 */
public record BookRow(
    int rowNumber,
    String id,
    String title,
    String subject,
    String monthlyGoal,
    String unitLoad,
    String chapterName,
    String chapterStart,
    String chapterEnd,
    String numbering)
    implements SheetRow<BookRow> {

  public BookRow {
    id = blankIfNull(id);
    title = blankIfNull(title);
    subject = blankIfNull(subject);
    monthlyGoal = blankIfNull(monthlyGoal);
    unitLoad = blankIfNull(unitLoad);
    chapterName = blankIfNull(chapterName);
    chapterStart = blankIfNull(chapterStart);
    chapterEnd = blankIfNull(chapterEnd);
    numbering = blankIfNull(numbering);
  }

  /** Whether this row starts a book block. */
  public boolean isParent() {
    return !id.isBlank();
  }

  public String valueOf(BookField field) {
    return switch (field) {
      case TITLE -> title;
      case SUBJECT -> subject;
      case MONTHLY_GOAL -> monthlyGoal;
      case UNIT_LOAD -> unitLoad;
    };
  }

  /** Copy with one metadata cell replaced. */
  public BookRow with(BookField field, String value) {
    return switch (field) {
      case TITLE -> new BookRow(
          rowNumber, id, value, subject, monthlyGoal, unitLoad, chapterName, chapterStart,
          chapterEnd, numbering);
      case SUBJECT -> new BookRow(
          rowNumber, id, title, value, monthlyGoal, unitLoad, chapterName, chapterStart,
          chapterEnd, numbering);
      case MONTHLY_GOAL -> new BookRow(
          rowNumber, id, title, subject, value, unitLoad, chapterName, chapterStart, chapterEnd,
          numbering);
      case UNIT_LOAD -> new BookRow(
          rowNumber, id, title, subject, monthlyGoal, value, chapterName, chapterStart,
          chapterEnd, numbering);
    };
  }

  @Override
  public BookRow atRow(int newRowNumber) {
    return new BookRow(
        newRowNumber, id, title, subject, monthlyGoal, unitLoad, chapterName, chapterStart,
        chapterEnd, numbering);
  }

  private static String blankIfNull(@Nullable String value) {
    return value == null ? "" : value;
  }
}
