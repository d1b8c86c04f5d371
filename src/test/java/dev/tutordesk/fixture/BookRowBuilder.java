package dev.tutordesk.fixture;

import dev.tutordesk.book.BookRow;

/**
 * Test builder for {@link BookRow}. Starts from an empty row; parent rows set an id, chapter rows
 * leave it blank.
 *
 * <pre>{@code
 * BookRow parent = BookRowBuilder.book("gMA001", "青チャート 数学IA").subject("数学").build();
 * BookRow chapter = BookRowBuilder.chapter("数と式", 1, 40).build();
 * }</pre>
 *
 * <p>Row numbers are left at 0; {@code InMemoryBookRowStore} assigns them.
 */
public final class BookRowBuilder {

  private String id = "";
  private String title = "";
  private String subject = "";
  private String monthlyGoal = "";
  private String unitLoad = "";
  private String chapterName = "";
  private String chapterStart = "";
  private String chapterEnd = "";
  private String numbering = "";

  public static BookRowBuilder book(String id, String title) {
    return new BookRowBuilder().id(id).title(title);
  }

  public static BookRowBuilder chapter(String name, int start, int end) {
    return new BookRowBuilder()
        .chapterName(name)
        .chapterStart(String.valueOf(start))
        .chapterEnd(String.valueOf(end));
  }

  public BookRowBuilder id(String id) {
    this.id = id;
    return this;
  }

  public BookRowBuilder title(String title) {
    this.title = title;
    return this;
  }

  public BookRowBuilder subject(String subject) {
    this.subject = subject;
    return this;
  }

  public BookRowBuilder monthlyGoal(String monthlyGoal) {
    this.monthlyGoal = monthlyGoal;
    return this;
  }

  public BookRowBuilder unitLoad(String unitLoad) {
    this.unitLoad = unitLoad;
    return this;
  }

  public BookRowBuilder chapterName(String chapterName) {
    this.chapterName = chapterName;
    return this;
  }

  public BookRowBuilder chapterStart(String chapterStart) {
    this.chapterStart = chapterStart;
    return this;
  }

  public BookRowBuilder chapterEnd(String chapterEnd) {
    this.chapterEnd = chapterEnd;
    return this;
  }

  public BookRowBuilder numbering(String numbering) {
    this.numbering = numbering;
    return this;
  }

  public BookRow build() {
    return new BookRow(
        0, id, title, subject, monthlyGoal, unitLoad, chapterName, chapterStart, chapterEnd,
        numbering);
  }
}
