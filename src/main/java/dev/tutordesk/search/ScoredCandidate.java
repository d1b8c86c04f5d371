package dev.tutordesk.search;

/**
 * A corpus record together with its final ranking score.
 *
 * @param record the scored record
 * @param score final score in [0, 1], rounded to 4 decimal places
 * @param reason the match tier that produced the base score
 * @param <R> record type
 */
public record ScoredCandidate<R extends SearchableRecord>(
    R record, double score, MatchReason reason) {}
