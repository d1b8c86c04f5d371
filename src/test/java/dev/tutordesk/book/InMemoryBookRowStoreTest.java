package dev.tutordesk.book;

import static dev.tutordesk.fixture.BookRowBuilder.book;
import static dev.tutordesk.fixture.BookRowBuilder.chapter;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.tutordesk.sheet.RowStoreException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryBookRowStoreTest {

  private InMemoryBookRowStore store;

  @BeforeEach
  void setUp() {
    store =
        new InMemoryBookRowStore(
            List.of(
                book("a1", "Alpha").build(),
                chapter("one", 1, 10).build(),
                book("b1", "Beta").build()));
  }

  @Test
  void seedRowsAreNumberedFromRowTwo() {
    assertThat(store.listRows()).extracting(BookRow::rowNumber).containsExactly(2, 3, 4);
  }

  @Test
  void listRowsReturnsSnapshot() {
    List<BookRow> before = store.listRows();

    store.deleteRows(2, 1);

    assertThat(before).hasSize(3);
    assertThat(store.listRows()).hasSize(2);
  }

  @Test
  void updateCellsReplacesOnlyGivenFields() {
    store.updateCells(4, Map.of(BookField.TITLE, "Beta 2", BookField.UNIT_LOAD, "5"));

    BookRow row = store.listRows().get(2);
    assertThat(row.id()).isEqualTo("b1");
    assertThat(row.title()).isEqualTo("Beta 2");
    assertThat(row.unitLoad()).isEqualTo("5");
    assertThat(row.rowNumber()).isEqualTo(4);
  }

  @Test
  void deleteRowsRenumbersFollowingRows() {
    store.deleteRows(2, 2);

    assertThat(store.listRows())
        .singleElement()
        .satisfies(
            row -> {
              assertThat(row.id()).isEqualTo("b1");
              assertThat(row.rowNumber()).isEqualTo(2);
            });
  }

  @Test
  void appendRowsContinuesNumbering() {
    store.appendRows(List.of(book("c1", "Gamma").build()));

    assertThat(store.listRows().get(3).rowNumber()).isEqualTo(5);
  }

  @Test
  void rowOutsideDataRangeIsRejected() {
    assertThatThrownBy(() -> store.updateCells(1, Map.of(BookField.TITLE, "header")))
        .isInstanceOf(RowStoreException.class)
        .hasMessageContaining("Row 1");
  }

  @Test
  void deletingPastEndOfSheetIsRejected() {
    assertThatThrownBy(() -> store.deleteRows(3, 5))
        .isInstanceOf(RowStoreException.class)
        .hasMessageContaining("sheet ends at row 4");
    assertThat(store.listRows()).hasSize(3);
  }

  @Test
  void nonPositiveCountIsRejected() {
    assertThatThrownBy(() -> store.deleteRows(2, 0)).isInstanceOf(RowStoreException.class);
  }
}
