package dev.tutordesk.sheet;

import dev.tutordesk.text.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Conjunction of column conditions: {@code where} values must equal a cell of the column, {@code
 * contains} values must occur inside one. Cells and values are compared after {@link
 * TextNormalizer#normalize}. A condition on an unknown column never matches.
 *
 * @param <C> column type
 */
public final class RowFilter<C> {

  private final List<Condition<C>> conditions;

  private RowFilter(List<Condition<C>> conditions) {
    this.conditions = List.copyOf(conditions);
  }

  /**
   * @param where column key to exact value
   * @param contains column key to substring
   * @param resolveColumn maps a caller's column key to a column
   */
  public static <C> RowFilter<C> of(
      @Nullable Map<String, ?> where,
      @Nullable Map<String, ?> contains,
      Function<String, Optional<C>> resolveColumn) {
    List<Condition<C>> conditions = new ArrayList<>();
    add(conditions, where, true, resolveColumn);
    add(conditions, contains, false, resolveColumn);
    return new RowFilter<>(conditions);
  }

  private static <C> void add(
      List<Condition<C>> conditions,
      @Nullable Map<String, ?> values,
      boolean exact,
      Function<String, Optional<C>> resolveColumn) {
    if (values == null) {
      return;
    }
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      conditions.add(
          new Condition<>(
              resolveColumn.apply(entry.getKey()).orElse(null),
              TextNormalizer.normalize(String.valueOf(entry.getValue())),
              exact));
    }
  }

  /**
   * @param cells the cell values of a column for the candidate (one per row it spans)
   */
  public boolean matches(Function<C, List<String>> cells) {
    for (Condition<C> condition : conditions) {
      if (condition.column() == null || !condition.test(cells.apply(condition.column()))) {
        return false;
      }
    }
    return true;
  }

  private record Condition<C>(@Nullable C column, String value, boolean exact) {

    boolean test(List<String> cells) {
      for (String cell : cells) {
        String normalized = TextNormalizer.normalize(cell);
        if (exact ? normalized.equals(value) : normalized.contains(value)) {
          return true;
        }
      }
      return false;
    }
  }
}
