package dev.tutordesk.sheet;

import org.jspecify.annotations.Nullable;

/** Renders caller-supplied values as sheet cell text. */
public final class CellText {

  private CellText() {}

  /** Null becomes an empty cell; whole numbers are written without a decimal point. */
  public static String of(@Nullable Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
      return String.valueOf(d.longValue());
    }
    return value.toString();
  }
}
