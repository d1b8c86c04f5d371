package dev.tutordesk.sheet;

import java.util.List;
import java.util.Map;

/**
 * Port to a row-oriented store that owns one sheet.
 *
 * <p>Implementations throw {@link RowStoreException} on I/O or addressing failures.
 *
 * @param <R> row type
 * @param <F> writable cell type
 */
public interface RowStore<R extends SheetRow<R>, F> {

  /** Every data row in sheet order. */
  List<R> listRows();

  /** Overwrite cells of one row. */
  void updateCells(int rowNumber, Map<F, String> values);

  /** Delete {@code count} consecutive rows starting at {@code startRow}; later rows shift up. */
  void deleteRows(int startRow, int count);

  /** Append rows after the last data row; their row numbers are reassigned. */
  void appendRows(List<R> rows);
}
