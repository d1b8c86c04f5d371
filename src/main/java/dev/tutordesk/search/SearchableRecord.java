package dev.tutordesk.search;

/**
 * A read-only textual entity that the {@link CandidateRanker} can score. Implementations are
 * transient snapshots of rows owned by an external store.
 *
 * <p>A blank {@link #id()} marks a detail row (for books, a chapter row) rather than a top-level
 * document; such records never enter the corpus.
 */
public interface SearchableRecord {

  String id();

  String title();

  String subject();
}
