package dev.tutordesk.search;

import java.util.Collection;

/**
 * BM25-smoothed inverse document frequency: {@code ln(((N - df + 0.5) / (df + 0.5)) + 1)}.
 *
 * <p>The {@code + 1} inside the logarithm keeps the weight positive even for a lexeme present in
 * every document; an unseen lexeme gets the largest weight the corpus allows.
 */
public final class IdfScorer {

  private IdfScorer() {}

  public static double idf(int documentFrequency, int totalDocs) {
    return Math.log(((totalDocs - documentFrequency + 0.5) / (documentFrequency + 0.5)) + 1);
  }

  public static double idf(String lexeme, DocumentFrequencyIndex<?> index) {
    return idf(index.frequencyOf(lexeme), index.totalDocs());
  }

  /** Sum of the weights of {@code lexemes}. */
  public static double sum(Collection<String> lexemes, DocumentFrequencyIndex<?> index) {
    double total = 0.0;
    for (String lexeme : lexemes) {
      total += idf(lexeme, index);
    }
    return total;
  }
}
