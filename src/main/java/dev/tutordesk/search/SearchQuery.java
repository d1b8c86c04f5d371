package dev.tutordesk.search;

import dev.tutordesk.text.TextNormalizer;
import org.jspecify.annotations.Nullable;

/**
 * Ranking request: the free-text query and the maximum number of candidates to return.
 *
 * @param text the query text (must not be null, and not blank once normalized)
 * @param limit the maximum number of candidates (must be >= 1)
 */
public record SearchQuery(String text, int limit) {

  /** Default number of candidates when not specified. */
  public static final int DEFAULT_LIMIT = 20;

  /** Compact constructor validating input. */
  public SearchQuery {
    if (isBlank(text)) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
  }

  /**
   * Whether {@code text} is empty after {@link TextNormalizer#normalize}. A lone no-break space
   * passes {@link String#isBlank()} but normalizes to nothing.
   */
  public static boolean isBlank(@Nullable String text) {
    return text == null || TextNormalizer.normalize(text).isBlank();
  }

  /** Convenience constructor defaulting limit to {@value #DEFAULT_LIMIT}. */
  public SearchQuery(String text) {
    this(text, DEFAULT_LIMIT);
  }
}
