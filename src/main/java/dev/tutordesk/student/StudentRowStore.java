package dev.tutordesk.student;

import dev.tutordesk.sheet.RowStore;

/** Port to the students sheet. */
public interface StudentRowStore extends RowStore<StudentRow, StudentField> {}
