package dev.tutordesk.book;

import dev.tutordesk.sheet.RowStore;

/**
 * Port to the row-oriented store that owns the books sheet. Only parent-row metadata cells are
 * writable in place; chapters are written by appending rows.
 */
public interface BookRowStore extends RowStore<BookRow, BookField> {}
