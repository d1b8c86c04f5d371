package dev.tutordesk.sheet;

/**
 * A data row of a sheet, addressed by its 1-based sheet row number. Row 1 is the header, so the
 * first data row is 2.
 *
 * @param <R> the concrete row type
 */
public interface SheetRow<R extends SheetRow<R>> {

  int rowNumber();

  /** Copy moved to another sheet row. */
  R atRow(int newRowNumber);
}
