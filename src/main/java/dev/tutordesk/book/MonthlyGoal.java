package dev.tutordesk.book;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Parsed monthly study goal. The sheet stores it as free text such as {@code 1.5時間} (hours per
 * day).
 *
 * @param text the raw cell text
 * @param perDayMinutes minutes per day, or null when the text names no hours
 */
public record MonthlyGoal(String text, @Nullable Integer perDayMinutes) {

  private static final Pattern HOURS = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*時間");

  public static MonthlyGoal parse(@Nullable String text) {
    String raw = text == null ? "" : text;
    Matcher matcher = HOURS.matcher(raw);
    if (matcher.find()) {
      double hours = Double.parseDouble(matcher.group(1));
      return new MonthlyGoal(raw, (int) Math.round(hours * 60));
    }
    return new MonthlyGoal(raw, null);
  }
}
