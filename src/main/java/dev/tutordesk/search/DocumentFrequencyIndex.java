package dev.tutordesk.search;

import dev.tutordesk.text.TextNormalizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Document frequency of every title lexeme over a corpus snapshot.
 *
 * <p>Each document contributes at most 1 to a lexeme's count, however often the lexeme repeats in
 * its title. Records with a blank id (detail rows) and repeated ids are not documents.
 *
 * @param documentFrequency lexeme to number of documents whose title contains it
 * @param totalDocs number of documents, never below 1
 * @param documents the distinct top-level records in corpus order
 * @param <R> record type
 */
public record DocumentFrequencyIndex<R extends SearchableRecord>(
    Map<String, Integer> documentFrequency, int totalDocs, List<R> documents) {

  public DocumentFrequencyIndex {
    documentFrequency = Map.copyOf(documentFrequency);
    documents = List.copyOf(documents);
  }

  /**
   * Builds the index over a corpus snapshot.
   *
   * @param records the corpus, including detail rows
   * @return the index; an empty corpus yields {@code totalDocs == 1} and no documents
   */
  public static <R extends SearchableRecord> DocumentFrequencyIndex<R> build(
      List<? extends R> records) {
    Map<String, Integer> df = new HashMap<>();
    List<R> documents = new ArrayList<>();
    Set<String> seenIds = new HashSet<>();

    for (R record : records) {
      String id = record.id() == null ? "" : record.id().strip();
      if (id.isEmpty() || !seenIds.add(id)) {
        continue;
      }
      documents.add(record);
      for (String lexeme : new HashSet<>(TextNormalizer.tokenize(record.title()))) {
        df.merge(lexeme, 1, Integer::sum);
      }
    }

    return new DocumentFrequencyIndex<>(df, Math.max(1, documents.size()), documents);
  }

  /** Number of documents containing {@code lexeme}; 0 when unseen. */
  public int frequencyOf(String lexeme) {
    return documentFrequency.getOrDefault(lexeme, 0);
  }
}
