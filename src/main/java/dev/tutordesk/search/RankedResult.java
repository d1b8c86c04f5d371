package dev.tutordesk.search;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a single ranking call. A result with no candidates is a valid, successful outcome.
 *
 * @param query the query as supplied by the caller
 * @param candidates surviving candidates, descending by score, stable on ties
 * @param confidence {@code clamp(s0 - w * s1, 0, 1)} rounded to 4 decimal places; 0 when empty
 * @param <R> record type
 */
public record RankedResult<R extends SearchableRecord>(
    String query, List<ScoredCandidate<R>> candidates, double confidence) {

  public RankedResult {
    candidates = List.copyOf(candidates);
  }

  static <R extends SearchableRecord> RankedResult<R> empty(String query) {
    return new RankedResult<>(query, List.of(), 0.0);
  }

  /** The best candidate, if any survived the cutoff. */
  public Optional<ScoredCandidate<R>> top() {
    return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
  }
}
