package de.bsommerfeld.cheru.catalog;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import de.bsommerfeld.cheru.core.domain.Entry;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Scores entry names against a query and returns the matching positions,
 * best first.
 *
 * <h3>Matching</h3>
 * The query must occur in the name as a subsequence. Both sides are
 * decomposed (NFKD) and stripped of combining marks, so {@code cafe} finds
 * {@code Café}. Matching is case-insensitive unless the query contains an
 * uppercase letter ("smart case").
 *
 * <h3>Scoring</h3>
 * Among all alignments of the query in the name, the best one is chosen by
 * dynamic programming. Every matched character earns {@link #SCORE_MATCH};
 * characters at a word start earn a boundary bonus (whitespace, delimiter,
 * camel case or digit transition), doubled for the first query character;
 * adjacent matches earn {@link #BONUS_CONSECUTIVE}; skipped characters between
 * two matches cost {@link #PENALTY_GAP_START} plus {@link #PENALTY_GAP_EXTENSION}
 * per further character. Names that start with the query get
 * {@link #BONUS_PREFIX}, names equal to it additionally {@link #BONUS_EXACT}.
 *
 * <p>
 * Results with equal scores keep their input order. Instances hold scratch
 * buffers and a cache of normalized names and are <strong>not</strong>
 * thread-safe.
 */
public final class FuzzyMatcher {

    static final int SCORE_MATCH = 16;
    static final int PENALTY_GAP_START = -3;
    static final int PENALTY_GAP_EXTENSION = -1;
    static final int BONUS_BOUNDARY = 8;
    static final int BONUS_BOUNDARY_WHITESPACE = 10;
    static final int BONUS_BOUNDARY_DELIMITER = 9;
    static final int BONUS_CAMEL = 7;
    static final int BONUS_CONSECUTIVE = 4;
    static final int BONUS_FIRST_CHAR_MULTIPLIER = 2;
    static final int BONUS_PREFIX = 24;
    static final int BONUS_EXACT = 48;

    /** Returned by {@link #score} when the query does not match. */
    static final int NO_MATCH = Integer.MIN_VALUE;

    private static final int NEG = Integer.MIN_VALUE / 4;
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final String DELIMITERS = "/\\,:;|_-.";

    private final Cache<String, String> normalizedNames = CacheBuilder.newBuilder()
            .maximumSize(8192)
            .build();

    private int[] bonus = new int[64];
    private int[] previousRow = new int[64];
    private int[] currentRow = new int[64];

    /**
     * Returns the positions in {@code entries} whose name matches
     * {@code query}, best match first. A blank query matches everything in
     * input order.
     */
    public int[] search(String query, List<Entry> entries) {
        String trimmed = query == null ? "" : query.strip();
        if (trimmed.isEmpty()) {
            int[] all = new int[entries.size()];
            for (int i = 0; i < all.length; i++) {
                all[i] = i;
            }
            return all;
        }

        String needle = normalize(trimmed);
        boolean caseSensitive = hasUpperCase(needle);
        if (!caseSensitive) {
            needle = needle.toLowerCase(Locale.ROOT);
        }

        List<Scored> scored = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            int score = scoreNormalized(needle, haystack(entries.get(i).name(), caseSensitive));
            if (score != NO_MATCH) {
                scored.add(new Scored(i, score));
            }
        }

        // List.sort is stable: equal scores keep input order
        scored.sort((a, b) -> Integer.compare(b.score, a.score));

        int[] result = new int[scored.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = scored.get(i).position;
        }
        return result;
    }

    /**
     * Scores a single name. Exposed for tests and diagnostics.
     *
     * @return the score, or {@link #NO_MATCH}
     */
    int score(String query, String name) {
        String needle = normalize(query.strip());
        if (needle.isEmpty())
            return 0;
        boolean caseSensitive = hasUpperCase(needle);
        if (!caseSensitive) {
            needle = needle.toLowerCase(Locale.ROOT);
        }
        return scoreNormalized(needle, haystack(name, caseSensitive));
    }

    private String haystack(String name, boolean caseSensitive) {
        String normalized = normalizedNames.getIfPresent(name);
        if (normalized == null) {
            normalized = normalize(name);
            normalizedNames.put(name, normalized);
        }
        return caseSensitive ? normalized : normalized.toLowerCase(Locale.ROOT);
    }

    private int scoreNormalized(String needle, String text) {
        int m = needle.length();
        int n = text.length();
        if (m > n || !isSubsequence(needle, text))
            return NO_MATCH;

        ensureCapacity(n);
        computeBonuses(text, n);

        // Row for the first query character: no preceding gap is penalized
        char first = needle.charAt(0);
        for (int j = 0; j < n; j++) {
            previousRow[j] = text.charAt(j) == first
                    ? SCORE_MATCH + bonus[j] * BONUS_FIRST_CHAR_MULTIPLIER
                    : NEG;
        }

        for (int i = 1; i < m; i++) {
            char qc = needle.charAt(i);
            int gapBest = NEG;
            for (int j = 0; j < n; j++) {
                if (j >= 2) {
                    gapBest = Math.max(gapBest + PENALTY_GAP_EXTENSION, previousRow[j - 2] + PENALTY_GAP_START);
                }
                if (j < i || text.charAt(j) != qc) {
                    currentRow[j] = NEG;
                    continue;
                }
                int consecutive = previousRow[j - 1] > NEG
                        ? previousRow[j - 1] + BONUS_CONSECUTIVE
                        : NEG;
                int best = Math.max(consecutive, gapBest);
                currentRow[j] = best > NEG ? best + SCORE_MATCH + bonus[j] : NEG;
            }
            int[] swap = previousRow;
            previousRow = currentRow;
            currentRow = swap;
        }

        int best = NEG;
        for (int j = 0; j < n; j++) {
            best = Math.max(best, previousRow[j]);
        }
        if (best <= NEG)
            return NO_MATCH;

        if (text.startsWith(needle)) {
            best += BONUS_PREFIX;
            if (text.length() == needle.length()) {
                best += BONUS_EXACT;
            }
        }
        return best;
    }

    private void computeBonuses(String text, int n) {
        char prev = ' ';
        for (int j = 0; j < n; j++) {
            char c = text.charAt(j);
            bonus[j] = boundaryBonus(prev, c);
            prev = c;
        }
    }

    static int boundaryBonus(char prev, char current) {
        if (!Character.isLetterOrDigit(current))
            return 0;
        if (Character.isWhitespace(prev))
            return BONUS_BOUNDARY_WHITESPACE;
        if (DELIMITERS.indexOf(prev) >= 0)
            return BONUS_BOUNDARY_DELIMITER;
        if (!Character.isLetterOrDigit(prev))
            return BONUS_BOUNDARY;
        if (Character.isLowerCase(prev) && Character.isUpperCase(current))
            return BONUS_CAMEL;
        if (!Character.isDigit(prev) && Character.isDigit(current))
            return BONUS_CAMEL;
        return 0;
    }

    private static boolean isSubsequence(String needle, String text) {
        int qi = 0;
        for (int j = 0; j < text.length() && qi < needle.length(); j++) {
            if (text.charAt(j) == needle.charAt(qi)) {
                qi++;
            }
        }
        return qi == needle.length();
    }

    private void ensureCapacity(int n) {
        if (bonus.length < n) {
            int size = Math.max(n, bonus.length * 2);
            bonus = Arrays.copyOf(bonus, size);
            previousRow = new int[size];
            currentRow = new int[size];
        }
    }

    static String normalize(String s) {
        String decomposed = Normalizer.normalize(s, Normalizer.Form.NFKD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }

    private static boolean hasUpperCase(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isUpperCase(s.charAt(i)))
                return true;
        }
        return false;
    }

    private static final class Scored {
        final int position;
        final int score;

        Scored(int position, int score) {
            this.position = position;
            this.score = score;
        }
    }
}
