package dev.tutordesk.sheet;

import java.util.Collection;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sequential ids of the form {@code <prefix><3+ digit sequence>}, e.g. {@code gMA017} or {@code
 * s042}. The next id is one past the highest sequence already used with the same prefix.
 */
public final class IdSequence {

  private IdSequence() {}

  /**
   * @param prefix id prefix, used verbatim
   * @param existingIds ids already in the sheet; blanks and other prefixes are ignored
   * @return {@code prefix} followed by the next sequence number, zero-padded to 3 digits
   */
  public static String next(String prefix, Collection<String> existingIds) {
    Pattern sequence = Pattern.compile("^" + Pattern.quote(prefix) + "(\\d+)$");
    long max = 0;
    for (String id : existingIds) {
      Matcher matcher = sequence.matcher(id.strip());
      if (matcher.matches()) {
        try {
          max = Math.max(max, Long.parseLong(matcher.group(1)));
        } catch (NumberFormatException e) {
          throw new IllegalStateException("Id sequence overflows: " + id, e);
        }
      }
    }
    return prefix + "%03d".formatted(max + 1);
  }
}
