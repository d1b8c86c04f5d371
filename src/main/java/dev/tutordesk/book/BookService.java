package dev.tutordesk.book;

import dev.tutordesk.book.BookMutations.DeletePayload;
import dev.tutordesk.book.BookMutations.UpdatePayload;
import dev.tutordesk.book.BookViews.Candidate;
import dev.tutordesk.mutation.ErrorCode;
import dev.tutordesk.mutation.FieldChange;
import dev.tutordesk.mutation.PreviewDraft;
import dev.tutordesk.mutation.ToolResponse;
import dev.tutordesk.mutation.ToolResponses;
import dev.tutordesk.mutation.TwoPhaseCoordinator;
import dev.tutordesk.search.CandidateRanker;
import dev.tutordesk.search.RankedResult;
import dev.tutordesk.search.RankingProperties;
import dev.tutordesk.search.ScoredCandidate;
import dev.tutordesk.search.SearchQuery;
import dev.tutordesk.sheet.CellText;
import dev.tutordesk.sheet.IdSequence;
import dev.tutordesk.sheet.RowFilter;
import dev.tutordesk.sheet.RowStoreException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reference-book operations over the books sheet: fuzzy find, list, get, filter, create, and
 * two-phase update and delete.
 *
 * <p>Every operation reloads the sheet from the {@link BookRowStore}; nothing is cached between
 * calls except staged mutation payloads. Operations never throw: failures come back as {@link
 * ToolResponse} errors.
 */
@Service
public class BookService {

  private static final Logger log = LoggerFactory.getLogger(BookService.class);

  static final String OP_FIND = "books.find";
  static final String OP_LIST = "books.list";
  static final String OP_GET = "books.get";
  static final String OP_FILTER = "books.filter";
  static final String OP_CREATE = "books.create";
  static final String OP_UPDATE = "books.update";
  static final String OP_DELETE = "books.delete";

  private final BookRowStore rowStore;
  private final CandidateRanker ranker;
  private final TwoPhaseCoordinator coordinator;
  private final ToolResponses responses;
  private final RankingProperties rankingProperties;

  public BookService(
      BookRowStore rowStore,
      CandidateRanker ranker,
      TwoPhaseCoordinator coordinator,
      ToolResponses responses,
      RankingProperties rankingProperties) {
    this.rowStore = rowStore;
    this.ranker = ranker;
    this.coordinator = coordinator;
    this.responses = responses;
    this.rankingProperties = rankingProperties;
  }

  /**
   * Ranks books by IDF-weighted fuzzy match against {@code query}.
   *
   * @param query free text (required)
   * @param limit maximum candidates; defaults to 20, clamped to the configured maximum
   */
  public ToolResponse find(@Nullable String query, @Nullable Integer limit) {
    if (SearchQuery.isBlank(query)) {
      return responses.error(OP_FIND, ErrorCode.BAD_REQUEST, "query is required");
    }
    try {
      List<BookRecord> records =
          rowStore.listRows().stream().filter(BookRow::isParent).map(BookRecord::from).toList();
      RankedResult<BookRecord> ranked =
          ranker.rank(new SearchQuery(query, clampLimit(limit)), records);

      List<Candidate> candidates = ranked.candidates().stream().map(BookService::toView).toList();
      return responses.ok(
          OP_FIND,
          new BookViews.SearchResult(
              query,
              candidates,
              candidates.isEmpty() ? null : candidates.get(0),
              ranked.confidence()));
    } catch (RowStoreException e) {
      return storeFailure(OP_FIND, e);
    }
  }

  /** Lists id, title and subject of every book in sheet order. */
  public ToolResponse list(@Nullable Integer limit) {
    try {
      Set<String> seen = new HashSet<>();
      List<BookViews.Summary> books = new ArrayList<>();
      for (BookRow row : rowStore.listRows()) {
        String id = row.id().strip();
        if (!row.isParent() || !seen.add(id)) {
          continue;
        }
        books.add(new BookViews.Summary(id, row.title(), row.subject()));
      }
      if (limit != null && limit > 0 && books.size() > limit) {
        books = books.subList(0, limit);
      }
      return responses.ok(OP_LIST, new BookViews.SummaryList(List.copyOf(books), books.size()));
    } catch (RowStoreException e) {
      return storeFailure(OP_LIST, e);
    }
  }

  /** Returns metadata, monthly goal and chapters of one book. */
  public ToolResponse get(@Nullable String bookId) {
    if (bookId == null || bookId.isBlank()) {
      return responses.error(OP_GET, ErrorCode.BAD_REQUEST, "book_id is required");
    }
    try {
      List<BookRow> rows = rowStore.listRows();
      if (rows.isEmpty()) {
        return emptySheet(OP_GET);
      }
      Optional<BookBlock> block = BookBlock.locate(rows, bookId);
      if (block.isEmpty()) {
        return notFound(OP_GET, bookId);
      }
      return responses.ok(OP_GET, new BookViews.Book(block.get().details()));
    } catch (RowStoreException e) {
      return storeFailure(OP_GET, e);
    }
  }

  /**
   * Returns several books in sheet order. Ids that match no book are skipped.
   *
   * @param bookIds at least one id
   */
  public ToolResponse getMany(@Nullable List<String> bookIds) {
    if (bookIds == null || bookIds.stream().allMatch(id -> id == null || id.isBlank())) {
      return responses.error(OP_GET, ErrorCode.BAD_REQUEST, "book_ids is required");
    }
    Set<String> wanted = new HashSet<>();
    for (String id : bookIds) {
      if (id != null) {
        wanted.add(id.strip());
      }
    }
    try {
      List<BookRow> rows = rowStore.listRows();
      if (rows.isEmpty()) {
        return emptySheet(OP_GET);
      }
      List<BookDetails> books = new ArrayList<>();
      for (BookBlock block : BookBlock.all(rows)) {
        if (wanted.remove(block.id())) {
          books.add(block.details());
        }
      }
      if (!wanted.isEmpty()) {
        log.debug("{}: no book for ids {}", OP_GET, wanted);
      }
      return responses.ok(OP_GET, new BookViews.Books(List.copyOf(books)));
    } catch (RowStoreException e) {
      return storeFailure(OP_GET, e);
    }
  }

  /**
   * Returns the books whose rows satisfy every condition. A condition holds when any row of the
   * block (parent or chapter) has a matching cell in that column.
   *
   * @param where column name to exact value, compared after normalization
   * @param contains column name to substring, compared after normalization
   * @param limit maximum books; unlimited when null or below 1
   */
  public ToolResponse filter(
      @Nullable Map<String, ?> where,
      @Nullable Map<String, ?> contains,
      @Nullable Integer limit) {
    RowFilter<BookColumn> filter = RowFilter.of(where, contains, BookColumn::fromName);
    Integer applied = limit != null && limit > 0 ? limit : null;
    try {
      List<BookDetails> books = new ArrayList<>();
      for (BookBlock block : BookBlock.all(rowStore.listRows())) {
        if (applied != null && books.size() >= applied) {
          break;
        }
        if (filter.matches(column -> cellsOf(block, column))) {
          books.add(block.details());
        }
      }
      return responses.ok(
          OP_FILTER, new BookViews.FilterResult(List.copyOf(books), books.size(), applied));
    } catch (RowStoreException e) {
      return storeFailure(OP_FILTER, e);
    }
  }

  /**
   * Appends a new book block. The id is the subject code prefix (or {@link BookDraft#idPrefix()})
   * followed by the next free sequence number.
   */
  public ToolResponse create(@Nullable BookDraft draft) {
    if (draft == null || isBlank(draft.title()) || isBlank(draft.subject())) {
      return responses.error(OP_CREATE, ErrorCode.BAD_REQUEST, "title and subject are required");
    }
    try {
      List<String> existingIds =
          rowStore.listRows().stream().filter(BookRow::isParent).map(BookRow::id).toList();
      String id = IdSequence.next(idPrefix(draft), existingIds);
      List<BookRow> newRows = blockRows(id, draft);
      rowStore.appendRows(newRows);
      log.info("{}: created book {} with {} rows", OP_CREATE, id, newRows.size());
      return responses.ok(OP_CREATE, new BookViews.Created(id, newRows.size()));
    } catch (RowStoreException e) {
      return storeFailure(OP_CREATE, e);
    }
  }

  /**
   * Updates book metadata in two phases. Without a token, previews the field changes and returns
   * a confirm token; with a token, writes the staged values.
   *
   * @param updates field name to new value; unknown field names are ignored
   */
  public ToolResponse update(
      @Nullable String bookId,
      @Nullable Map<String, ?> updates,
      @Nullable String confirmToken) {
    if (bookId == null || bookId.isBlank()) {
      return responses.error(OP_UPDATE, ErrorCode.BAD_REQUEST, "book_id is required");
    }
    String id = bookId.strip();
    try {
      List<BookRow> rows = rowStore.listRows();
      if (rows.isEmpty()) {
        return emptySheet(OP_UPDATE);
      }
      Optional<BookBlock> found = BookBlock.locate(rows, id);
      if (found.isEmpty()) {
        return notFound(OP_UPDATE, id);
      }
      BookBlock block = found.get();

      return coordinator.execute(
          OP_UPDATE,
          BookMutations.UPDATE,
          id,
          confirmToken,
          () -> previewUpdate(id, block, updates),
          payload -> applyUpdate(id, block, payload));
    } catch (RowStoreException e) {
      return storeFailure(OP_UPDATE, e);
    }
  }

  /**
   * Deletes a book block (parent and chapter rows) in two phases. Without a token, previews the
   * rows to delete; with a token, deletes them.
   */
  public ToolResponse delete(@Nullable String bookId, @Nullable String confirmToken) {
    if (bookId == null || bookId.isBlank()) {
      return responses.error(OP_DELETE, ErrorCode.BAD_REQUEST, "book_id is required");
    }
    String id = bookId.strip();
    try {
      List<BookRow> rows = rowStore.listRows();
      if (rows.isEmpty()) {
        return emptySheet(OP_DELETE);
      }
      Optional<BookBlock> found = BookBlock.locate(rows, id);
      if (found.isEmpty()) {
        return notFound(OP_DELETE, id);
      }
      BookBlock block = found.get();

      return coordinator.execute(
          OP_DELETE,
          BookMutations.DELETE,
          id,
          confirmToken,
          () ->
              new PreviewDraft<>(
                  new DeletePayload(block.rowCount()),
                  new BookViews.DeletePreview(
                      id,
                      block.rowCount(),
                      new BookViews.RowRange(block.parentRow(), block.endRow() - 1))),
          payload -> {
            if (payload.rowCount() != block.rowCount()) {
              throw new IllegalStateException(
                  "book '%s' changed since preview: %d rows previewed, %d now"
                      .formatted(id, payload.rowCount(), block.rowCount()));
            }
            rowStore.deleteRows(block.parentRow(), block.rowCount());
            return new BookViews.Deleted(id, block.rowCount());
          });
    } catch (RowStoreException e) {
      return storeFailure(OP_DELETE, e);
    }
  }

  private PreviewDraft<UpdatePayload> previewUpdate(
      String bookId, BookBlock block, @Nullable Map<String, ?> updates) {
    Map<BookField, String> accepted = new EnumMap<>(BookField.class);
    if (updates != null) {
      for (Map.Entry<String, ?> entry : updates.entrySet()) {
        Optional<BookField> field = BookField.fromKey(entry.getKey());
        if (field.isPresent()) {
          accepted.put(field.get(), CellText.of(entry.getValue()));
        } else {
          log.debug("{}: ignoring unknown field '{}'", OP_UPDATE, entry.getKey());
        }
      }
    }

    Map<String, FieldChange> changes = new LinkedHashMap<>();
    BookRow parent = block.parent();
    for (Map.Entry<BookField, String> entry : accepted.entrySet()) {
      String from = parent.valueOf(entry.getKey());
      if (!from.equals(entry.getValue())) {
        changes.put(entry.getKey().key(), new FieldChange(from, entry.getValue()));
      }
    }

    return new PreviewDraft<>(
        new UpdatePayload(accepted),
        new BookViews.UpdatePreview(bookId, changes));
  }

  /** Writes to the block's current parent row; earlier deletions may have moved it. */
  private BookViews.Updated applyUpdate(String bookId, BookBlock block, UpdatePayload payload) {
    if (!payload.updates().isEmpty()) {
      rowStore.updateCells(block.parentRow(), payload.updates());
    }
    return new BookViews.Updated(bookId, true, List.copyOf(payload.updates().keySet()));
  }

  private static List<String> cellsOf(BookBlock block, BookColumn column) {
    List<String> cells = new ArrayList<>();
    for (BookRow row : block.rows()) {
      String cell = column.cellOf(row);
      if (!cell.isBlank()) {
        cells.add(cell);
      }
    }
    return cells;
  }

  private static String idPrefix(BookDraft draft) {
    String given = draft.idPrefix();
    String custom = given == null ? "" : given.strip();
    if (custom.isEmpty()) {
      return BookIdPrefixes.forBook(draft.subject().strip(), draft.title().strip());
    }
    return custom.startsWith("g") ? custom : "g" + custom;
  }

  /** Parent row with the first chapter, then one row per further chapter. */
  private static List<BookRow> blockRows(String id, BookDraft draft) {
    List<BookDraft.ChapterDraft> chapters = draft.chapters();
    List<BookRow> rows = new ArrayList<>();
    BookDraft.@Nullable ChapterDraft first = chapters.isEmpty() ? null : chapters.get(0);
    rows.add(
        chapterRow(
            id,
            draft.title().strip(),
            draft.subject().strip(),
            draft.monthlyGoal(),
            draft.unitLoad() == null ? "" : String.valueOf(draft.unitLoad()),
            first));
    for (int i = 1; i < chapters.size(); i++) {
      rows.add(chapterRow("", "", "", "", "", chapters.get(i)));
    }
    return rows;
  }

  private static BookRow chapterRow(
      String id,
      String title,
      String subject,
      @Nullable String monthlyGoal,
      String unitLoad,
      BookDraft.@Nullable ChapterDraft chapter) {
    Chapter.Range range = chapter == null ? null : chapter.range();
    return new BookRow(
        0,
        id,
        title,
        subject,
        monthlyGoal,
        unitLoad,
        chapter == null ? null : chapter.title(),
        range == null ? null : CellText.of(range.start()),
        range == null ? null : CellText.of(range.end()),
        chapter == null ? null : chapter.numbering());
  }

  private static boolean isBlank(@Nullable String value) {
    return value == null || value.isBlank();
  }

  private static Candidate toView(ScoredCandidate<BookRecord> scored) {
    BookRecord book = scored.record();
    return new Candidate(book.id(), book.title(), book.subject(), scored.score(), scored.reason());
  }

  private int clampLimit(@Nullable Integer limit) {
    if (limit == null || limit < 1) {
      return SearchQuery.DEFAULT_LIMIT;
    }
    return Math.min(limit, rankingProperties.getMaxLimit());
  }

  private ToolResponse notFound(String op, String bookId) {
    return responses.error(op, ErrorCode.NOT_FOUND, "book_id '%s' not found".formatted(bookId));
  }

  private ToolResponse emptySheet(String op) {
    return responses.error(op, ErrorCode.EMPTY, "books sheet has no rows");
  }

  private ToolResponse storeFailure(String op, RowStoreException e) {
    log.warn("{}: row store failure: {}", op, e.getMessage(), e);
    return responses.error(op, ErrorCode.ERROR, String.valueOf(e.getMessage()));
  }
}
