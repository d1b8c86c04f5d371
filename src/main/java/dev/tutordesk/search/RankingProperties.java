package dev.tutordesk.search;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised tunables for {@link CandidateRanker}.
 *
 * <p>Properties are bound from {@code tutordesk.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code gap-threshold} - score drop between neighbours that truncates the list (default
 *       0.05)
 *   <li>{@code runner-up-weight} - weight of the second score in the confidence formula (default
 *       0.25)
 *   <li>{@code coverage-bonus-cap} - upper bound of the IDF-coverage bonus (default 0.12)
 *   <li>{@code prefix-bonus} - bonus when the title starts with the query (default 0.02)
 *   <li>{@code subject-bonus} - bonus when a subject keyword in the query names the record's
 *       subject (default 0.02)
 *   <li>{@code max-limit} - upper bound for caller-supplied limits (default 50)
 *   <li>{@code subject-keywords} - subject names detected in queries, in priority order
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "tutordesk.search")
public class RankingProperties {

  private double gapThreshold = 0.05;
  private double runnerUpWeight = 0.25;
  private double coverageBonusCap = 0.12;
  private double prefixBonus = 0.02;
  private double subjectBonus = 0.02;
  private int maxLimit = 50;
  private List<String> subjectKeywords =
      new ArrayList<>(
          List.of("現代文", "古文", "漢文", "英語", "数学", "化学", "物理", "生物", "日本史", "世界史", "地理"));

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    requireUnitInterval("gap-threshold", gapThreshold);
    requireUnitInterval("runner-up-weight", runnerUpWeight);
    requireUnitInterval("coverage-bonus-cap", coverageBonusCap);
    requireUnitInterval("prefix-bonus", prefixBonus);
    requireUnitInterval("subject-bonus", subjectBonus);
    if (maxLimit < 1) {
      throw new IllegalStateException(
          "tutordesk.search.max-limit must be at least 1, got: " + maxLimit);
    }
  }

  private static void requireUnitInterval(String name, double value) {
    if (value < 0.0 || value > 1.0) {
      throw new IllegalStateException(
          "tutordesk.search." + name + " must be in [0.0, 1.0], got: " + value);
    }
  }

  public double getGapThreshold() {
    return gapThreshold;
  }

  public void setGapThreshold(double gapThreshold) {
    this.gapThreshold = gapThreshold;
  }

  public double getRunnerUpWeight() {
    return runnerUpWeight;
  }

  public void setRunnerUpWeight(double runnerUpWeight) {
    this.runnerUpWeight = runnerUpWeight;
  }

  public double getCoverageBonusCap() {
    return coverageBonusCap;
  }

  public void setCoverageBonusCap(double coverageBonusCap) {
    this.coverageBonusCap = coverageBonusCap;
  }

  public double getPrefixBonus() {
    return prefixBonus;
  }

  public void setPrefixBonus(double prefixBonus) {
    this.prefixBonus = prefixBonus;
  }

  public double getSubjectBonus() {
    return subjectBonus;
  }

  public void setSubjectBonus(double subjectBonus) {
    this.subjectBonus = subjectBonus;
  }

  public int getMaxLimit() {
    return maxLimit;
  }

  public void setMaxLimit(int maxLimit) {
    this.maxLimit = maxLimit;
  }

  public List<String> getSubjectKeywords() {
    return subjectKeywords;
  }

  public void setSubjectKeywords(List<String> subjectKeywords) {
    this.subjectKeywords = subjectKeywords;
  }
}
