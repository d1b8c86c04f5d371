package dev.tutordesk.text;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

/**
 * Utility class that canonicalizes free text for matching and splits it into search lexemes.
 * Handles the mixed Japanese/Latin titles found in the books sheet: compatibility forms are
 * folded (NFKC), numbered-volume glyphs become ASCII digits, and short or generic words are
 * dropped.
 */
public final class TextNormalizer {

    /** Generic book-title words that carry no discriminating power. */
    static final Set<String> STOPWORDS = Set.of(
            "問題集", "入試", "演習", "講座", "ノート",
            "完全", "総合", "実戦", "実践"
    );

    private static final Map<Character, String> DIGIT_GLYPHS = Map.ofEntries(
            Map.entry('Ⅰ', "1"), Map.entry('Ⅱ', "2"), Map.entry('Ⅲ', "3"), Map.entry('Ⅳ', "4"),
            Map.entry('Ⅴ', "5"), Map.entry('Ⅵ', "6"), Map.entry('Ⅶ', "7"), Map.entry('Ⅷ', "8"),
            Map.entry('Ⅸ', "9"), Map.entry('Ⅹ', "10"),
            Map.entry('①', "1"), Map.entry('②', "2"), Map.entry('③', "3"), Map.entry('④', "4"),
            Map.entry('⑤', "5"), Map.entry('⑥', "6"), Map.entry('⑦', "7"), Map.entry('⑧', "8"),
            Map.entry('⑨', "9"), Map.entry('⑩', "10"),
            Map.entry('０', "0"), Map.entry('１', "1"), Map.entry('２', "2"), Map.entry('３', "3"),
            Map.entry('４', "4"), Map.entry('５', "5"), Map.entry('６', "6"), Map.entry('７', "7"),
            Map.entry('８', "8"), Map.entry('９', "9")
    );

    /** Ideograph, one or two hiragana, ideograph: e.g. 数学の基礎 splits into 数学 / 基礎. */
    private static final Pattern IDEOGRAPH_KANA_IDEOGRAPH =
            Pattern.compile("([一-龯])[ぁ-ん]{1,2}([一-龯])");

    private static final Pattern TOKEN_SEPARATOR =
            Pattern.compile("[^\\w一-龯ぁ-んァ-ン]+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern WHITESPACE =
            Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final int MIN_TOKEN_LENGTH = 2;

    private TextNormalizer() {
        // utility class
    }

    /**
     * Folds text for equality and substring comparison: trims, lowercases and applies NFKC. The
     * result is trimmed again, since NFKC turns a no-break space into a plain one.
     *
     * @param text any text, possibly null
     * @return the folded text, or an empty string for null input
     */
    public static String normalize(@Nullable String text) {
        if (text == null) {
            return "";
        }
        String lowered = text.strip().toLowerCase(Locale.ROOT);
        return Normalizer.normalize(lowered, Normalizer.Form.NFKC).strip();
    }

    /**
     * Folds a column or field key: {@link #normalize}, then all whitespace removed, so {@code
     * "参考書 名"} and {@code "参考書名"} name the same column.
     */
    public static String normalizeKey(@Nullable String key) {
        return WHITESPACE.matcher(normalize(key)).replaceAll("");
    }

    /**
     * Splits text into search lexemes.
     *
     * <ul>
     *   <li>Roman numerals, circled digits and fullwidth digits become ASCII digits
     *   <li>NFKC folding, then a boundary between ideograph runs joined by 1-2 hiragana
     *   <li>lowercase, split on anything that is not a word, kanji or kana character
     *   <li>tokens shorter than 2 characters and stopwords are dropped
     * </ul>
     *
     * @param text any text, possibly null
     * @return lexemes in order of appearance (duplicates kept); empty for null or blank input
     */
    public static List<String> tokenize(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        String s = replaceDigitGlyphs(text);
        s = Normalizer.normalize(s, Normalizer.Form.NFKC);
        s = IDEOGRAPH_KANA_IDEOGRAPH.matcher(s).replaceAll("$1 $2");
        s = s.toLowerCase(Locale.ROOT);

        List<String> tokens = new ArrayList<>();
        for (String part : TOKEN_SEPARATOR.split(s)) {
            String token = part.strip();
            if (token.codePointCount(0, token.length()) >= MIN_TOKEN_LENGTH
                    && !STOPWORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static String replaceDigitGlyphs(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String digit = DIGIT_GLYPHS.get(c);
            if (digit != null) {
                sb.append(digit);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
