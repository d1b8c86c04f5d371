package dev.tutordesk.mcp;

import dev.tutordesk.book.BookDraft;
import dev.tutordesk.book.BookService;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing reference-book operations as tool methods for an assistant.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: every outcome, including unexpected exceptions, is
 * returned as a JSON {@link dev.tutordesk.mutation.ToolResponse} envelope and nothing is thrown.
 * Object and array arguments arrive as JSON text.
 *
 * <p>Mutating tools ({@code books_update}, {@code books_delete}) are two-phase: call once without
 * {@code confirmToken} to get a preview and a token, then again with the token to apply the change.
 *
 * @see McpToolConfig
 */
@Service
public class BookToolService {

  private final BookService bookService;
  private final ToolInvoker invoker;

  public BookToolService(BookService bookService, ToolInvoker invoker) {
    this.bookService = bookService;
    this.invoker = invoker;
  }

  /** Fuzzy search over book ids, titles and subjects. */
  @Tool(
      name = "books_find",
      description =
          "Find reference books by free-text query (title words, subject, or book ID). "
              + "Returns ranked candidates with scores, match reasons, the top candidate, "
              + "and a confidence value between 0 and 1.")
  public String findBooks(
      @ToolParam(description = "Search text, e.g. a partial title or book ID") @Nullable
          String query,
      @ToolParam(description = "Maximum number of candidates (1-50, default 20)", required = false)
          @Nullable Integer limit) {
    return invoker.run("books.find", () -> bookService.find(query, limit));
  }

  /** Lists every book with id, title and subject. */
  @Tool(name = "books_list", description = "List all reference books (ID, title, subject).")
  public String listBooks(
      @ToolParam(description = "Maximum number of books to return", required = false)
          @Nullable Integer limit) {
    return invoker.run("books.list", () -> bookService.list(limit));
  }

  /** Full details of one book, or of several when {@code bookIds} is given. */
  @Tool(
      name = "books_get",
      description =
          "Get reference books by ID, including monthly goal, unit load, and chapter list. "
              + "Pass bookId for one book or bookIds for several.")
  public String getBook(
      @ToolParam(description = "Book ID, e.g. gMA001", required = false) @Nullable String bookId,
      @ToolParam(description = "Several book IDs; takes precedence over bookId", required = false)
          @Nullable List<String> bookIds) {
    return invoker.run(
        "books.get",
        () -> {
          if (bookIds != null && !bookIds.isEmpty()) {
            return bookService.getMany(bookIds);
          }
          if (bookId == null || bookId.isBlank()) {
            return invoker.badRequest("books.get", "book_id or book_ids is required");
          }
          return bookService.get(bookId);
        });
  }

  /** Column conditions over every row of each book. */
  @Tool(
      name = "books_filter",
      description =
          "Filter reference books by column values. 'where' requires an exact match and "
              + "'contains' a substring, after case and width folding. Columns: id, title, "
              + "subject, monthly_goal, unit_load, chapter_name, numbering (or their sheet "
              + "headers). A book matches when any of its rows matches.")
  public String filterBooks(
      @ToolParam(description = "JSON object of column to exact value", required = false)
          @Nullable String where,
      @ToolParam(description = "JSON object of column to substring", required = false)
          @Nullable String contains,
      @ToolParam(description = "Maximum number of books to return", required = false)
          @Nullable Integer limit) {
    return invoker.run(
        "books.filter",
        () ->
            bookService.filter(
                invoker.object("where", where), invoker.object("contains", contains), limit));
  }

  /** Appends a new book with its chapters. */
  @Tool(
      name = "books_create",
      description =
          "Create a reference book. The ID is generated from the subject (e.g. gMA003) unless "
              + "idPrefix is given. Give the complete chapter list: the first chapter goes on "
              + "the book's own row, the rest on rows below it. Always fill numbering "
              + "(e.g. 問 for problem sets, No. for vocabulary books).")
  public String createBook(
      @ToolParam(description = "Book title") @Nullable String title,
      @ToolParam(description = "Subject, e.g. 数学 or 英語") @Nullable String subject,
      @ToolParam(description = "Items per study unit", required = false) @Nullable
          Integer unitLoad,
      @ToolParam(description = "Monthly goal text, e.g. 1時間", required = false) @Nullable
          String monthlyGoal,
      @ToolParam(
              description =
                  "JSON array of chapters, e.g. [{\"title\": \"数と式\", "
                      + "\"range\": {\"start\": 1, \"end\": 40}, \"numbering\": \"問\"}]",
              required = false)
          @Nullable String chapters,
      @ToolParam(description = "ID prefix, e.g. gMA", required = false) @Nullable
          String idPrefix) {
    return invoker.run(
        "books.create",
        () ->
            bookService.create(
                new BookDraft(
                    title,
                    subject,
                    unitLoad,
                    monthlyGoal,
                    invoker.list("chapters", chapters, BookDraft.ChapterDraft.class),
                    idPrefix)));
  }

  /** Two-phase metadata update. */
  @Tool(
      name = "books_update",
      description =
          "Update a reference book's title, subject, monthly_goal, or unit_load. "
              + "Call without confirmToken to preview the changes and receive a token; "
              + "call again with the same bookId and the token to apply them.")
  public String updateBook(
      @ToolParam(description = "Book ID to update") @Nullable String bookId,
      @ToolParam(
              description =
                  "JSON object of new values, e.g. {\"title\": \"...\", \"unit_load\": 2}. "
                      + "Required for preview; ignored on confirm.",
              required = false)
          @Nullable String updates,
      @ToolParam(description = "Token returned by the preview call", required = false)
          @Nullable String confirmToken) {
    return invoker.run(
        "books.update",
        () -> {
          if (confirmToken != null && !confirmToken.isBlank()) {
            return bookService.update(bookId, null, confirmToken);
          }
          Map<String, Object> parsed = invoker.object("updates", updates);
          if (parsed == null) {
            return invoker.badRequest("books.update", "updates is required for preview");
          }
          return bookService.update(bookId, parsed, null);
        });
  }

  /** Two-phase deletion of a book and its chapter rows. */
  @Tool(
      name = "books_delete",
      description =
          "Delete a reference book and its chapter rows. "
              + "Call without confirmToken to preview the rows to delete and receive a token; "
              + "call again with the same bookId and the token to delete them.")
  public String deleteBook(
      @ToolParam(description = "Book ID to delete") @Nullable String bookId,
      @ToolParam(description = "Token returned by the preview call", required = false)
          @Nullable String confirmToken) {
    return invoker.run("books.delete", () -> bookService.delete(bookId, confirmToken));
  }
}
