package dev.tutordesk.sheet;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local {@link RowStore}. Stands in for the spreadsheet connector, which lives outside
 * this application; useful for local runs and tests.
 *
 * <p>All access is synchronized on the instance. Row numbers are reassigned after deletions so
 * they always match the sheet position.
 *
 * @param <R> row type
 * @param <F> writable cell type
 */
public abstract class InMemoryRowStore<R extends SheetRow<R>, F> implements RowStore<R, F> {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRowStore.class);

  public static final int FIRST_DATA_ROW = 2;

  private final List<R> rows = new ArrayList<>();

  /** Seeds the store; the supplied row numbers are ignored and reassigned in order. */
  protected InMemoryRowStore(List<R> seed) {
    appendRows(seed);
  }

  /** Copy of {@code row} with one cell replaced. */
  protected abstract R withCell(R row, F field, String value);

  @Override
  public synchronized List<R> listRows() {
    return List.copyOf(rows);
  }

  @Override
  public synchronized void updateCells(int rowNumber, Map<F, String> values) {
    int index = indexOf(rowNumber);
    R row = rows.get(index);
    for (Map.Entry<F, String> cell : values.entrySet()) {
      row = withCell(row, cell.getKey(), cell.getValue());
    }
    rows.set(index, row);
    log.debug("Updated {} cells in row {}", values.size(), rowNumber);
  }

  @Override
  public synchronized void deleteRows(int startRow, int count) {
    if (count < 1) {
      throw new RowStoreException("Row count must be positive, got: " + count);
    }
    int from = indexOf(startRow);
    int to = from + count;
    if (to > rows.size()) {
      throw new RowStoreException(
          "Cannot delete %d rows from row %d: sheet ends at row %d"
              .formatted(count, startRow, FIRST_DATA_ROW + rows.size() - 1));
    }
    rows.subList(from, to).clear();
    for (int i = from; i < rows.size(); i++) {
      rows.set(i, rows.get(i).atRow(FIRST_DATA_ROW + i));
    }
    log.debug("Deleted rows {}..{}", startRow, startRow + count - 1);
  }

  @Override
  public synchronized void appendRows(List<R> newRows) {
    for (R row : newRows) {
      rows.add(row.atRow(FIRST_DATA_ROW + rows.size()));
    }
  }

  private int indexOf(int rowNumber) {
    int index = rowNumber - FIRST_DATA_ROW;
    if (index < 0 || index >= rows.size()) {
      throw new RowStoreException("Row " + rowNumber + " is outside the data range");
    }
    return index;
  }
}
