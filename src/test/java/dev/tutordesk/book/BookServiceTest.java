package dev.tutordesk.book;

import static dev.tutordesk.fixture.BookRowBuilder.book;
import static dev.tutordesk.fixture.BookRowBuilder.chapter;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;

import dev.tutordesk.mutation.ErrorCode;
import dev.tutordesk.mutation.FieldChange;
import dev.tutordesk.mutation.PreviewResponse;
import dev.tutordesk.mutation.ToolResponse;
import dev.tutordesk.mutation.ToolResponses;
import dev.tutordesk.mutation.TwoPhaseCoordinator;
import dev.tutordesk.search.CandidateRanker;
import dev.tutordesk.search.MatchReason;
import dev.tutordesk.search.RankingProperties;
import dev.tutordesk.sheet.RowStoreException;
import dev.tutordesk.staging.StagingCache;
import dev.tutordesk.staging.StagingProperties;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

class BookServiceTest {

  private static final List<BookRow> SHEET =
      List.of(
          book("gMA001", "青チャート 数学IA")
              .subject("数学")
              .monthlyGoal("1.5時間")
              .unitLoad("2")
              .chapterName("数と式")
              .chapterStart("1")
              .chapterEnd("40")
              .build(),
          chapter("二次関数", 41, 90).build(),
          book("gEN001", "Target 1900").subject("英語").monthlyGoal("1時間").unitLoad("1").build(),
          book("gPH001", "物理のエッセンス").subject("物理").build(),
          chapter("力学", 0, 0).chapterStart("").chapterEnd("").build());

  private final RankingProperties rankingProperties = new RankingProperties();
  private final ToolResponses responses = new ToolResponses();

  private InMemoryBookRowStore store;
  private BookService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryBookRowStore(SHEET);
    service = serviceOver(store);
  }

  private BookService serviceOver(BookRowStore rowStore) {
    StagingCache cache = new StagingCache(new StagingProperties(), Clock.systemUTC());
    return new BookService(
        rowStore,
        new CandidateRanker(rankingProperties),
        new TwoPhaseCoordinator(cache, responses),
        responses,
        rankingProperties);
  }

  private static <T> T data(ToolResponse response, Class<T> type) {
    assertThat(response.ok()).as("response %s", response).isTrue();
    assertThat(response.data()).isInstanceOf(type);
    return type.cast(response.data());
  }

  private static String tokenOf(ToolResponse preview) {
    return data(preview, PreviewResponse.class).confirmToken();
  }

  @Nested
  class Find {

    @Test
    void exactTitleRanksBookFirst() {
      BookViews.SearchResult result =
          data(service.find("Target 1900", null), BookViews.SearchResult.class);

      assertThat(result.query()).isEqualTo("Target 1900");
      assertThat(result.candidates())
          .extracting(BookViews.Candidate::bookId)
          .containsExactly("gEN001");
      assertThat(result.top()).isNotNull();
      assertThat(result.top().reason()).isEqualTo(MatchReason.EXACT);
      assertThat(result.confidence()).isEqualTo(1.0);
    }

    @Test
    void titlePhraseFindsBook() {
      BookViews.SearchResult result = data(service.find("青チャート", 5), BookViews.SearchResult.class);

      assertThat(result.top()).isNotNull();
      assertThat(result.top().bookId()).isEqualTo("gMA001");
      assertThat(result.top().subject()).isEqualTo("数学");
      assertThat(result.top().reason()).isEqualTo(MatchReason.PHRASE);
      assertThat(result.top().score()).isEqualTo(1.0);
    }

    @Test
    void noMatchGivesEmptyResult() {
      BookViews.SearchResult result =
          data(service.find("zzzz", null), BookViews.SearchResult.class);

      assertThat(result.candidates()).isEmpty();
      assertThat(result.top()).isNull();
      assertThat(result.confidence()).isZero();
    }

    @Test
    void blankQueryIsBadRequest() {
      ToolResponse response = service.find("  ", null);

      assertThat(response.op()).isEqualTo("books.find");
      assertThat(response.errorCode()).isEqualTo(ErrorCode.BAD_REQUEST);
      assertThat(response.error().message()).isEqualTo("query is required");
    }

    @Test
    void queryBlankAfterNormalizationIsBadRequest() {
      ToolResponse response = service.find("\u00A0\u3000", null);

      assertThat(response.errorCode()).isEqualTo(ErrorCode.BAD_REQUEST);
    }

    @Test
    void emptySheetGivesEmptyResult() {
      BookService emptyService = serviceOver(new InMemoryBookRowStore());

      BookViews.SearchResult result =
          data(emptyService.find("数学", null), BookViews.SearchResult.class);

      assertThat(result.candidates()).isEmpty();
    }
  }

  @Nested
  class ListBooks {

    @Test
    void listsParentsInSheetOrder() {
      BookViews.SummaryList list = data(service.list(null), BookViews.SummaryList.class);

      assertThat(list.count()).isEqualTo(3);
      assertThat(list.books())
          .containsExactly(
              new BookViews.Summary("gMA001", "青チャート 数学IA", "数学"),
              new BookViews.Summary("gEN001", "Target 1900", "英語"),
              new BookViews.Summary("gPH001", "物理のエッセンス", "物理"));
    }

    @Test
    void limitTruncates() {
      BookViews.SummaryList list = data(service.list(2), BookViews.SummaryList.class);

      assertThat(list.count()).isEqualTo(2);
      assertThat(list.books())
          .extracting(BookViews.Summary::id)
          .containsExactly("gMA001", "gEN001");
    }

    @Test
    void duplicateIdsAreListedOnce() {
      store.appendRows(List.of(book("gEN001", "Target 1900 (copy)").build()));

      BookViews.SummaryList list = data(service.list(null), BookViews.SummaryList.class);

      assertThat(list.books())
          .extracting(BookViews.Summary::id)
          .containsExactly("gMA001", "gEN001", "gPH001");
    }
  }

  @Nested
  class Get {

    @Test
    void returnsMetadataGoalAndChapters() {
      BookDetails book = data(service.get("gMA001"), BookViews.Book.class).book();

      assertThat(book.id()).isEqualTo("gMA001");
      assertThat(book.title()).isEqualTo("青チャート 数学IA");
      assertThat(book.subject()).isEqualTo("数学");
      assertThat(book.monthlyGoal()).isEqualTo(new MonthlyGoal("1.5時間", 90));
      assertThat(book.unitLoad()).isEqualTo(2);
      assertThat(book.chapters())
          .containsExactly(
              new Chapter(1, "数と式", new Chapter.Range(1, 40), null),
              new Chapter(2, "二次関数", new Chapter.Range(41, 90), null));
    }

    @Test
    void chapterWithoutPagesHasNoRange() {
      BookDetails book = data(service.get("gPH001"), BookViews.Book.class).book();

      assertThat(book.chapters()).containsExactly(new Chapter(1, "力学", null, null));
      assertThat(book.unitLoad()).isNull();
      assertThat(book.monthlyGoal().perDayMinutes()).isNull();
    }

    @Test
    void bookWithoutChaptersHasEmptyList() {
      BookDetails book = data(service.get("gEN001"), BookViews.Book.class).book();

      assertThat(book.chapters()).isEmpty();
      assertThat(book.monthlyGoal().perDayMinutes()).isEqualTo(60);
    }

    @Test
    void unknownIdIsNotFound() {
      ToolResponse response = service.get("gXX999");

      assertThat(response.errorCode()).isEqualTo(ErrorCode.NOT_FOUND);
      assertThat(response.error().message()).isEqualTo("book_id 'gXX999' not found");
    }

    @Test
    void emptySheetIsReported() {
      ToolResponse response = serviceOver(new InMemoryBookRowStore()).get("gMA001");

      assertThat(response.errorCode()).isEqualTo(ErrorCode.EMPTY);
    }

    @Test
    void missingIdIsBadRequest() {
      assertThat(service.get(null).errorCode()).isEqualTo(ErrorCode.BAD_REQUEST);
    }
  }

  @Nested
  class GetMany {

    @Test
    void returnsBooksInSheetOrderSkippingUnknownIds() {
      BookViews.Books books =
          data(
              service.getMany(List.of("gPH001", "gXX999", " gMA001 ", "gPH001")),
              BookViews.Books.class);

      assertThat(books.books()).extracting(BookDetails::id).containsExactly("gMA001", "gPH001");
      assertThat(books.books().get(0).chapters()).hasSize(2);
    }

    @Test
    void noIdsIsBadRequest() {
      assertThat(service.getMany(List.of()).errorCode()).isEqualTo(ErrorCode.BAD_REQUEST);
      assertThat(service.getMany(List.of(" ")).errorCode()).isEqualTo(ErrorCode.BAD_REQUEST);
    }

    @Test
    void emptySheetIsReported() {
      assertThat(serviceOver(new InMemoryBookRowStore()).getMany(List.of("gMA001")).errorCode())
          .isEqualTo(ErrorCode.EMPTY);
    }
  }

  @Nested
  class Filter {

    private List<String> idsOf(ToolResponse response) {
      return data(response, BookViews.FilterResult.class).books().stream()
          .map(BookDetails::id)
          .toList();
    }

    @Test
    void whereMatchesWholeNormalizedCell() {
      assertThat(idsOf(service.filter(Map.of("title", "TARGET 1900"), null, null)))
          .containsExactly("gEN001");
      assertThat(idsOf(service.filter(Map.of("title", "Target"), null, null))).isEmpty();
    }

    @Test
    void containsMatchesChapterRowsOfTheBlock() {
      assertThat(idsOf(service.filter(null, Map.of("chapter_name", "関数"), null)))
          .containsExactly("gMA001");
    }

    @Test
    void conditionsCombineAndAcceptSheetHeaders() {
      Map<String, Object> where = Map.of("教科", "数学");
      Map<String, Object> contains = Map.of("章の名前", "数と式");

      assertThat(idsOf(service.filter(where, contains, null))).containsExactly("gMA001");
      assertThat(idsOf(service.filter(where, Map.of("章の名前", "力学"), null))).isEmpty();
    }

    @Test
    void unknownColumnMatchesNothing() {
      assertThat(idsOf(service.filter(Map.of("publisher", "数研"), null, null))).isEmpty();
    }

    @Test
    void noConditionsReturnsEveryBookUpToLimit() {
      BookViews.FilterResult result =
          data(service.filter(null, null, 2), BookViews.FilterResult.class);

      assertThat(result.count()).isEqualTo(2);
      assertThat(result.limit()).isEqualTo(2);
      assertThat(result.books()).extracting(BookDetails::id).containsExactly("gMA001", "gEN001");
    }

    @Test
    void emptySheetGivesEmptyResult() {
      BookViews.FilterResult result =
          data(
              serviceOver(new InMemoryBookRowStore()).filter(Map.of("subject", "数学"), null, 0),
              BookViews.FilterResult.class);

      assertThat(result).isEqualTo(new BookViews.FilterResult(List.of(), 0, null));
    }
  }

  @Nested
  class Create {

    @Test
    void appendsBlockWithNextIdForSubjectCode() {
      BookDraft draft =
          new BookDraft(
              "Focus Gold",
              "数学",
              2,
              "1時間",
              List.of(
                  new BookDraft.ChapterDraft("数と式", new Chapter.Range(1, 30), "問"),
                  new BookDraft.ChapterDraft("図形と計量", new Chapter.Range(31, 60), null)),
              null);

      BookViews.Created created = data(service.create(draft), BookViews.Created.class);

      assertThat(created).isEqualTo(new BookViews.Created("gMA002", 2));
      assertThat(store.listRows()).extracting(BookRow::rowNumber).endsWith(7, 8);
      BookDetails book = data(service.get("gMA002"), BookViews.Book.class).book();
      assertThat(book.unitLoad()).isEqualTo(2);
      assertThat(book.monthlyGoal().perDayMinutes()).isEqualTo(60);
      assertThat(book.chapters())
          .containsExactly(
              new Chapter(1, "数と式", new Chapter.Range(1, 30), "問"),
              new Chapter(2, "図形と計量", new Chapter.Range(31, 60), null));
    }

    @Test
    void idPrefixOverridesSubjectCode() {
      BookDraft draft = new BookDraft("鉄壁", "英語", null, null, List.of(), "EW");

      BookViews.Created created = data(service.create(draft), BookViews.Created.class);

      assertThat(created).isEqualTo(new BookViews.Created("gEW001", 1));
    }

    @Test
    void unknownSubjectGetsPlaceholderCode() {
      BookDraft draft = new BookDraft("Origami", "Art", null, null, List.of(), null);

      assertThat(data(service.create(draft), BookViews.Created.class).id()).isEqualTo("gXX001");
    }

    @Test
    void emptySheetStartsSequenceAtOne() {
      BookService emptyService = serviceOver(new InMemoryBookRowStore());

      BookViews.Created created =
          data(
              emptyService.create(new BookDraft("基礎問題精講", "物理", null, null, null, null)),
              BookViews.Created.class);

      assertThat(created.id()).isEqualTo("gPP001");
    }

    @Test
    void missingTitleOrSubjectIsBadRequest() {
      BookDraft noTitle = new BookDraft(" ", "数学", null, null, List.of(), null);
      BookDraft noSubject = new BookDraft("Focus", null, null, null, List.of(), null);

      assertThat(service.create(noTitle).errorCode()).isEqualTo(ErrorCode.BAD_REQUEST);
      assertThat(service.create(noSubject).errorCode()).isEqualTo(ErrorCode.BAD_REQUEST);
      assertThat(store.listRows()).hasSize(5);
    }
  }

  @Nested
  class Update {

    @Test
    void previewListsOnlyChangedKnownFields() {
      Map<String, Object> updates = new LinkedHashMap<>();
      updates.put("unit_load", 3.0);
      updates.put("title", "青チャート 数学IA 改訂版");
      updates.put("subject", "数学");
      updates.put("color", "red");

      PreviewResponse preview =
          data(service.update("gMA001", updates, null), PreviewResponse.class);

      assertThat(preview.requiresConfirmation()).isTrue();
      assertThat(preview.expiresInSeconds()).isEqualTo(300);
      assertThat(preview.preview())
          .isEqualTo(
              new BookViews.UpdatePreview(
                  "gMA001",
                  Map.of(
                      "title",
                      new FieldChange("青チャート 数学IA", "青チャート 数学IA 改訂版"),
                      "unit_load", new FieldChange("2", "3"))));
      assertThat(store.listRows().get(0).title()).isEqualTo("青チャート 数学IA");
    }

    @Test
    void confirmWritesStagedValues() {
      String token =
          tokenOf(service.update("gMA001", Map.of("unit_load", 3.0, "monthly_goal", "2時間"), null));

      BookViews.Updated updated =
          data(service.update("gMA001", null, token), BookViews.Updated.class);

      assertThat(updated.bookId()).isEqualTo("gMA001");
      assertThat(updated.updated()).isTrue();
      assertThat(updated.fields()).containsExactly(BookField.MONTHLY_GOAL, BookField.UNIT_LOAD);
      BookRow parent = store.listRows().get(0);
      assertThat(parent.unitLoad()).isEqualTo("3");
      assertThat(parent.monthlyGoal()).isEqualTo("2時間");
    }

    @Test
    void tokenCannotBeReused() {
      String token = tokenOf(service.update("gMA001", Map.of("title", "New"), null));
      service.update("gMA001", null, token);

      ToolResponse replay = service.update("gMA001", null, token);

      assertThat(replay.errorCode()).isEqualTo(ErrorCode.CONFIRM_EXPIRED);
    }

    @Test
    void tokenForAnotherBookIsMismatch() {
      String token = tokenOf(service.update("gMA001", Map.of("title", "New"), null));

      ToolResponse response = service.update("gEN001", null, token);

      assertThat(response.errorCode()).isEqualTo(ErrorCode.CONFIRM_MISMATCH);
      assertThat(store.listRows().get(2).title()).isEqualTo("Target 1900");
    }

    @Test
    void deleteTokenIsNotAcceptedForUpdate() {
      String token = tokenOf(service.delete("gMA001", null));

      ToolResponse response = service.update("gMA001", null, token);

      assertThat(response.errorCode()).isEqualTo(ErrorCode.CONFIRM_EXPIRED);
    }

    @Test
    void confirmWritesToBookAfterEarlierBlockWasDeleted() {
      store =
          new InMemoryBookRowStore(
              List.of(
                  book("gXX001", "Alpha").build(),
                  book("gXX002", "Bravo").build(),
                  book("gXX003", "Charlie").build()));
      service = serviceOver(store);
      String updateToken = tokenOf(service.update("gXX002", Map.of("title", "Bravo 2nd ed"), null));
      service.delete("gXX001", tokenOf(service.delete("gXX001", null)));

      data(service.update("gXX002", null, updateToken), BookViews.Updated.class);

      assertThat(store.listRows())
          .extracting(BookRow::rowNumber, BookRow::id, BookRow::title)
          .containsExactly(tuple(2, "gXX002", "Bravo 2nd ed"), tuple(3, "gXX003", "Charlie"));
    }

    @Test
    void unknownBookIsNotFoundBeforeStaging() {
      ToolResponse response = service.update("gXX999", Map.of("title", "New"), null);

      assertThat(response.errorCode()).isEqualTo(ErrorCode.NOT_FOUND);
    }

    @Test
    void missingIdIsBadRequest() {
      assertThat(service.update(" ", Map.of("title", "New"), null).errorCode())
          .isEqualTo(ErrorCode.BAD_REQUEST);
    }
  }

  @Nested
  class Delete {

    @Test
    void previewShowsBlockRowRange() {
      PreviewResponse preview = data(service.delete("gMA001", null), PreviewResponse.class);

      assertThat(preview.preview())
          .isEqualTo(new BookViews.DeletePreview("gMA001", 2, new BookViews.RowRange(2, 3)));
      assertThat(store.listRows()).hasSize(5);
    }

    @Test
    void confirmDeletesParentAndChapterRows() {
      String token = tokenOf(service.delete("gMA001", null));

      BookViews.Deleted deleted = data(service.delete("gMA001", token), BookViews.Deleted.class);

      assertThat(deleted).isEqualTo(new BookViews.Deleted("gMA001", 2));
      assertThat(store.listRows()).extracting(BookRow::rowNumber).containsExactly(2, 3, 4);
      assertThat(store.listRows().get(0).id()).isEqualTo("gEN001");
      assertThat(service.get("gMA001").errorCode()).isEqualTo(ErrorCode.NOT_FOUND);
    }

    @Test
    void lastBlockRunsToEndOfSheet() {
      PreviewResponse preview = data(service.delete("gPH001", null), PreviewResponse.class);

      assertThat(preview.preview())
          .isEqualTo(new BookViews.DeletePreview("gPH001", 2, new BookViews.RowRange(5, 6)));
    }

    @Test
    void confirmDeletesBookAfterEarlierBlockWasDeleted() {
      String token = tokenOf(service.delete("gEN001", null));
      service.delete("gMA001", tokenOf(service.delete("gMA001", null)));

      data(service.delete("gEN001", token), BookViews.Deleted.class);

      assertThat(store.listRows())
          .extracting(BookRow::id, BookRow::chapterName)
          .containsExactly(tuple("gPH001", ""), tuple("", "力学"));
    }

    @Test
    void blockThatGrewSincePreviewIsNotDeleted() {
      String token = tokenOf(service.delete("gPH001", null));
      store.appendRows(List.of(chapter("熱力学", 1, 20).build()));

      ToolResponse response = service.delete("gPH001", token);

      assertThat(response.errorCode()).isEqualTo(ErrorCode.ERROR);
      assertThat(response.error().message())
          .isEqualTo("book 'gPH001' changed since preview: 2 rows previewed, 3 now");
      assertThat(store.listRows()).hasSize(6);
    }

    @Test
    void emptySheetIsReported() {
      assertThat(serviceOver(new InMemoryBookRowStore()).delete("gMA001", null).errorCode())
          .isEqualTo(ErrorCode.EMPTY);
    }
  }

  @Nested
  @ExtendWith(MockitoExtension.class)
  class StoreFailures {

    @Mock BookRowStore failingStore;

    @Test
    void readFailureIsReportedAsError() {
      given(failingStore.listRows()).willThrow(new RowStoreException("quota exceeded"));

      ToolResponse response = serviceOver(failingStore).find("数学", null);

      assertThat(response.errorCode()).isEqualTo(ErrorCode.ERROR);
      assertThat(response.error().message()).isEqualTo("quota exceeded");
    }

    @Test
    void writeFailureOnConfirmIsReportedAsError() {
      given(failingStore.listRows()).willReturn(new InMemoryBookRowStore(SHEET).listRows());
      willThrow(new RowStoreException("sheet is protected")).given(failingStore).deleteRows(2, 2);
      BookService failing = serviceOver(failingStore);
      String token = tokenOf(failing.delete("gMA001", null));

      ToolResponse response = failing.delete("gMA001", token);

      assertThat(response.op()).isEqualTo("books.delete");
      assertThat(response.errorCode()).isEqualTo(ErrorCode.ERROR);
      assertThat(response.error().message()).isEqualTo("sheet is protected");
    }
  }
}
