package dev.tutordesk.search;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The match tier that produced a candidate's base score. Tiers are evaluated in declaration order
 * and the first one that matches wins.
 */
public enum MatchReason {
  /** A haystack (id, title or subject) equals the query. */
  EXACT("exact", 1.0),
  /** The query is a substring of the title. */
  PHRASE("phrase", 0.95),
  /** The query is a substring of the id or subject. */
  PARTIAL_TARGET("partial_target", 0.90),
  /** Some query lexemes occur in the title. */
  COVERAGE("coverage", 0.80),
  /** The first three characters of the query occur in a haystack. */
  FUZZY3("fuzzy3", 0.72),
  /** No tier matched; any score comes from bonuses alone. */
  NONE("none", 0.0);

  private final String value;
  private final double baseScore;

  MatchReason(String value, double baseScore) {
    this.value = value;
    this.baseScore = baseScore;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public double baseScore() {
    return baseScore;
  }
}
