package dev.tutordesk.book;

import dev.tutordesk.text.TextNormalizer;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Columns of the books sheet that {@code books.filter} can match on. A column is named by its key
 * or by one of its sheet headers; names are compared after {@link TextNormalizer#normalizeKey}.
 */
public enum BookColumn {
  ID(BookRow::id, "id", "参考書ID"),
  TITLE(BookRow::title, "title", "参考書名", "タイトル", "書名"),
  SUBJECT(BookRow::subject, "subject", "教科", "科目"),
  MONTHLY_GOAL(BookRow::monthlyGoal, "monthly_goal", "月間目標", "goal"),
  UNIT_LOAD(BookRow::unitLoad, "unit_load", "単位当たり処理量", "単位処理量"),
  CHAPTER_NAME(BookRow::chapterName, "chapter_name", "章の名前", "章名"),
  NUMBERING(BookRow::numbering, "numbering", "番号の数え方", "番号");

  private final Function<BookRow, String> cell;
  private final List<String> names;

  BookColumn(Function<BookRow, String> cell, String... names) {
    this.cell = cell;
    this.names = List.of(names);
  }

  String cellOf(BookRow row) {
    return cell.apply(row);
  }

  public static Optional<BookColumn> fromName(String name) {
    String key = TextNormalizer.normalizeKey(name);
    for (BookColumn column : values()) {
      for (String candidate : column.names) {
        if (TextNormalizer.normalizeKey(candidate).equals(key)) {
          return Optional.of(column);
        }
      }
    }
    return Optional.empty();
  }
}
