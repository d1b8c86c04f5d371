package dev.tutordesk.search;

import dev.tutordesk.text.TextNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fuzzy ranking of short textual records against a free-text query.
 *
 * <p>Pipeline: normalise and tokenise the query -> build a document-frequency index over the
 * corpus snapshot -> score every document by the first matching tier ({@link MatchReason}) plus
 * IDF-coverage, prefix and subject bonuses -> clamp to 1.0 -> sort by score, then tier, then
 * corpus order -> cut at the first large score gap -> limit -> derive confidence from the top two
 * scores.
 *
 * <p>Holds no state between calls; the corpus is supplied fresh on every call.
 */
@Service
public class CandidateRanker {

  private static final Logger log = LoggerFactory.getLogger(CandidateRanker.class);

  private static final int FUZZY_PREFIX_LENGTH = 3;
  private static final int MIN_HAYSTACK_LENGTH = 2;

  private final RankingProperties properties;

  public CandidateRanker(RankingProperties properties) {
    this.properties = properties;
  }

  /**
   * Ranks {@code records} against {@code query}.
   *
   * @throws IllegalArgumentException if the query is blank or the limit is below 1
   */
  public <R extends SearchableRecord> RankedResult<R> rank(
      String query, List<? extends R> records, int limit) {
    return rank(new SearchQuery(query, limit), records);
  }

  /**
   * Ranks {@code records} against a validated query.
   *
   * @param query the query and result limit
   * @param records corpus snapshot; detail rows (blank id) are ignored
   * @return ranked candidates; empty with confidence 0 when nothing matches
   */
  public <R extends SearchableRecord> RankedResult<R> rank(
      SearchQuery query, List<? extends R> records) {
    if (records.isEmpty()) {
      return RankedResult.empty(query.text());
    }

    String normalizedQuery = TextNormalizer.normalize(query.text());
    List<String> queryTokens = TextNormalizer.tokenize(query.text());
    Set<String> queryLexemes = new LinkedHashSet<>(queryTokens);
    @Nullable String querySubject = detectSubject(queryTokens);

    DocumentFrequencyIndex<R> index = DocumentFrequencyIndex.build(records);
    double sumIdfQuery = IdfScorer.sum(queryLexemes, index);
    if (sumIdfQuery == 0.0) {
      sumIdfQuery = 1.0;
    }

    List<ScoredCandidate<R>> scored = new ArrayList<>();
    for (R document : index.documents()) {
      ScoredCandidate<R> candidate =
          score(document, normalizedQuery, queryLexemes, querySubject, index, sumIdfQuery);
      if (candidate.score() > 0) {
        scored.add(candidate);
      }
    }
    // equal scores rank by tier (exact first); List.sort is stable, so then by corpus order
    scored.sort(
        Comparator.comparingDouble(ScoredCandidate<R>::score)
            .reversed()
            .thenComparing(ScoredCandidate<R>::reason));

    List<ScoredCandidate<R>> survivors = applyGapCutoff(scored, query.limit());
    double confidence = confidence(survivors);

    log.debug(
        "Ranked query '{}': {} documents, {} scored, {} returned, confidence={}",
        query.text(),
        index.documents().size(),
        scored.size(),
        survivors.size(),
        confidence);

    return new RankedResult<>(query.text(), survivors, confidence);
  }

  private <R extends SearchableRecord> ScoredCandidate<R> score(
      R document,
      String normalizedQuery,
      Set<String> queryLexemes,
      @Nullable String querySubject,
      DocumentFrequencyIndex<R> index,
      double sumIdfQuery) {
    List<String> haystacks = haystacks(document);
    String normalizedTitle = TextNormalizer.normalize(document.title());
    Set<String> titleLexemes = new HashSet<>(TextNormalizer.tokenize(document.title()));

    double idfHit = 0.0;
    for (String lexeme : queryLexemes) {
      if (titleLexemes.contains(lexeme)) {
        idfHit += IdfScorer.idf(lexeme, index);
      }
    }
    double idfCoverage = idfHit / sumIdfQuery;

    MatchReason reason = matchTier(normalizedQuery, normalizedTitle, haystacks, idfCoverage);

    double bonus = 0.0;
    if (idfCoverage > 0) {
      double cap = properties.getCoverageBonusCap();
      bonus += Math.min(cap, cap * idfCoverage);
    }
    if (normalizedTitle.startsWith(normalizedQuery)) {
      bonus += properties.getPrefixBonus();
    }
    if (querySubject != null
        && TextNormalizer.normalize(querySubject)
            .equals(TextNormalizer.normalize(document.subject()))) {
      bonus += properties.getSubjectBonus();
    }

    double total = Math.min(1.0, reason.baseScore() + bonus);
    return new ScoredCandidate<>(document, round4(total), reason);
  }

  static MatchReason matchTier(
      String normalizedQuery, String normalizedTitle, List<String> haystacks, double idfCoverage) {
    if (haystacks.stream().anyMatch(h -> h.equals(normalizedQuery))) {
      return MatchReason.EXACT;
    }
    if (normalizedTitle.contains(normalizedQuery)) {
      return MatchReason.PHRASE;
    }
    if (haystacks.stream().anyMatch(h -> h.contains(normalizedQuery))) {
      return MatchReason.PARTIAL_TARGET;
    }
    if (idfCoverage > 0) {
      return MatchReason.COVERAGE;
    }
    String prefix = codePointPrefix(normalizedQuery, FUZZY_PREFIX_LENGTH);
    if (prefix != null && haystacks.stream().anyMatch(h -> h.contains(prefix))) {
      return MatchReason.FUZZY3;
    }
    return MatchReason.NONE;
  }

  /**
   * Truncates at the first adjacent pair whose scores differ by at least the gap threshold, then
   * to {@code limit}. Gaps are compared at the 4-decimal precision of the scores.
   */
  <R extends SearchableRecord> List<ScoredCandidate<R>> applyGapCutoff(
      List<ScoredCandidate<R>> sorted, int limit) {
    int cutIndex = sorted.size();
    for (int i = 0; i + 1 < sorted.size(); i++) {
      double gap = round4(sorted.get(i).score() - sorted.get(i + 1).score());
      if (gap >= properties.getGapThreshold()) {
        cutIndex = i + 1;
        break;
      }
    }
    return List.copyOf(sorted.subList(0, Math.min(limit, cutIndex)));
  }

  /** {@code clamp(s0 - w * s1, 0, 1)}; a missing runner-up counts as 0. */
  double confidence(List<? extends ScoredCandidate<?>> survivors) {
    if (survivors.isEmpty()) {
      return 0.0;
    }
    double first = survivors.get(0).score();
    double second = survivors.size() > 1 ? survivors.get(1).score() : 0.0;
    double raw = first - properties.getRunnerUpWeight() * second;
    return round4(Math.max(0.0, Math.min(1.0, raw)));
  }

  private @Nullable String detectSubject(List<String> queryTokens) {
    Set<String> lowered = new HashSet<>();
    for (String token : queryTokens) {
      lowered.add(token.toLowerCase(Locale.ROOT));
    }
    for (String keyword : properties.getSubjectKeywords()) {
      if (lowered.contains(keyword.toLowerCase(Locale.ROOT))) {
        return keyword;
      }
    }
    return null;
  }

  private static List<String> haystacks(SearchableRecord record) {
    List<String> haystacks = new ArrayList<>(3);
    for (String field : new String[] {record.id(), record.title(), record.subject()}) {
      String normalized = TextNormalizer.normalize(field);
      if (normalized.codePointCount(0, normalized.length()) >= MIN_HAYSTACK_LENGTH) {
        haystacks.add(normalized);
      }
    }
    return haystacks;
  }

  private static @Nullable String codePointPrefix(String text, int codePoints) {
    if (text.codePointCount(0, text.length()) < codePoints) {
      return null;
    }
    return text.substring(0, text.offsetByCodePoints(0, codePoints));
  }

  static double round4(double value) {
    return Math.round(value * 10_000.0) / 10_000.0;
  }
}
