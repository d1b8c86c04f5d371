package dev.tutordesk.book;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Subject keywords to the two-letter code used in book ids ({@code g} + code + sequence, e.g.
 * {@code gMA017}). The first keyword found in "subject title" wins, so longer keywords come first.
 */
final class BookIdPrefixes {

  static final String UNKNOWN = "XX";

  private static final Map<String, String> CODES = new LinkedHashMap<>();

  static {
    CODES.put("英語ライティング", "EW");
    CODES.put("英語コミュニケーション", "EC");
    CODES.put("英語", "EN");
    CODES.put("数学B", "MB");
    CODES.put("数学C", "MC");
    CODES.put("数学I", "M1");
    CODES.put("数学II", "M2");
    CODES.put("数学III", "M3");
    CODES.put("数学A", "MA");
    CODES.put("数学", "MA");
    CODES.put("古文", "JG");
    CODES.put("漢文", "JK");
    CODES.put("現代文", "JM");
    CODES.put("国語", "JA");
    CODES.put("物理", "PP");
    CODES.put("化学", "PC");
    CODES.put("生物", "PB");
    CODES.put("地学", "PE");
    CODES.put("日本史", "HJ");
    CODES.put("世界史", "HW");
    CODES.put("地理", "HG");
    CODES.put("政治経済", "HP");
    CODES.put("倫理", "HE");
    CODES.put("現代社会", "HS");
  }

  private BookIdPrefixes() {}

  /** {@code g} followed by the subject code, e.g. {@code gMA}. */
  static String forBook(String subject, String title) {
    String combined = subject + " " + title;
    for (Map.Entry<String, String> entry : CODES.entrySet()) {
      if (combined.contains(entry.getKey())) {
        return "g" + entry.getValue();
      }
    }
    return "g" + UNKNOWN;
  }
}
