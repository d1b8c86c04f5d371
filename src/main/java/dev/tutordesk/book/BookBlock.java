package dev.tutordesk.book;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * The rows of one book: the parent row and the chapter rows below it, up to the next parent row.
 *
 * @param parentRow sheet row of the parent
 * @param endRow first sheet row after the block (exclusive)
 * @param rows parent row followed by chapter rows
 */
record BookBlock(int parentRow, int endRow, List<BookRow> rows) {

  BookBlock {
    rows = List.copyOf(rows);
  }

  BookRow parent() {
    return rows.get(0);
  }

  String id() {
    return parent().id().strip();
  }

  int rowCount() {
    return endRow - parentRow;
  }

  /** Locates the first block whose parent id equals {@code bookId}. */
  static Optional<BookBlock> locate(List<BookRow> sheet, String bookId) {
    String target = bookId.strip();
    return all(sheet).stream().filter(block -> block.id().equals(target)).findFirst();
  }

  /** Every block in sheet order. Chapter rows above the first parent belong to no block. */
  static List<BookBlock> all(List<BookRow> sheet) {
    List<BookBlock> blocks = new ArrayList<>();
    List<BookRow> current = new ArrayList<>();
    for (BookRow row : sheet) {
      if (row.isParent()) {
        addBlock(blocks, current);
        current = new ArrayList<>();
        current.add(row);
      } else if (!current.isEmpty()) {
        current.add(row);
      }
    }
    addBlock(blocks, current);
    return blocks;
  }

  private static void addBlock(List<BookBlock> blocks, List<BookRow> rows) {
    if (!rows.isEmpty()) {
      int parentRow = rows.get(0).rowNumber();
      blocks.add(new BookBlock(parentRow, parentRow + rows.size(), rows));
    }
  }

  /** Metadata, monthly goal and chapter list of this book. */
  BookDetails details() {
    BookRow parent = parent();
    List<Chapter> chapters = new ArrayList<>();
    for (BookRow row : rows) {
      Integer start = toInteger(row.chapterStart());
      Integer end = toInteger(row.chapterEnd());
      String name = row.chapterName().strip();
      if (name.isEmpty() && start == null && end == null) {
        continue;
      }
      String numbering = row.numbering().strip();
      chapters.add(
          new Chapter(
              chapters.size() + 1,
              name.isEmpty() ? null : name,
              start == null && end == null ? null : new Chapter.Range(start, end),
              numbering.isEmpty() ? null : numbering));
    }
    return new BookDetails(
        id(),
        parent.title(),
        parent.subject(),
        MonthlyGoal.parse(parent.monthlyGoal()),
        toInteger(parent.unitLoad()),
        List.copyOf(chapters));
  }

  static @Nullable Integer toInteger(String cell) {
    String trimmed = cell.strip();
    if (trimmed.isEmpty()) {
      return null;
    }
    try {
      return (int) Math.round(Double.parseDouble(trimmed));
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
