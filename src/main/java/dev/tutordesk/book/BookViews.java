package dev.tutordesk.book;

import dev.tutordesk.mutation.FieldChange;
import dev.tutordesk.search.MatchReason;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Response payloads of {@link BookService} operations. */
public final class BookViews {

  private BookViews() {}

  /** A ranked book. */
  public record Candidate(
      String bookId, String title, String subject, double score, MatchReason reason) {}

  /** Result of {@code books.find}. */
  public record SearchResult(
      String query, List<Candidate> candidates, @Nullable Candidate top, double confidence) {}

  /** Id, title and subject of a book. */
  public record Summary(String id, String title, String subject) {}

  /** Result of {@code books.list}. */
  public record SummaryList(List<Summary> books, int count) {}

  /** Result of {@code books.get}. */
  public record Book(BookDetails book) {}

  /** Result of {@code books.get} with several ids, in sheet order. */
  public record Books(List<BookDetails> books) {}

  /**
   * Result of {@code books.filter}.
   *
   * @param limit the applied limit, or null when unlimited
   */
  public record FilterResult(List<BookDetails> books, int count, @Nullable Integer limit) {}

  /** Result of {@code books.create}. */
  public record Created(String id, int createdRows) {}

  /** Preview of {@code books.update}. */
  public record UpdatePreview(String bookId, Map<String, FieldChange> metaChanges) {}

  /** Result of a confirmed {@code books.update}. */
  public record Updated(String bookId, boolean updated, List<BookField> fields) {}

  /** Sheet row range, both ends inclusive. */
  public record RowRange(int startRow, int endRow) {}

  /** Preview of {@code books.delete}. */
  public record DeletePreview(String bookId, int deleteRows, RowRange range) {}

  /** Result of a confirmed {@code books.delete}. */
  public record Deleted(String bookId, int deletedRows) {}
}
