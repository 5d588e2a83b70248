package io.github.cyfko.dartql.core.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Edit-distance based matching of user input against a known set of names.
 * <p>
 * Used by the lexer to suggest a field name for a typo, and by reference resolution (dartboard, status or
 * assignee names typed by users) to propose the closest known values.
 * </p>
 *
 * <p><b>Usage example:</b></p>
 * <pre>{@code
 * FuzzyMatcher.levenshteinDistance("priorty", "priority");               // 1
 * FuzzyMatcher.closest("priorty", vocabulary.fields(), 2);               // Optional[priority]
 * FuzzyMatcher.closestMatches("enginering", dartboards, 2, 3);           // [Engineering]
 * }</pre>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FuzzyMatcher {

    /**
     * Private constructor to prevent instantiation.
     */
    private FuzzyMatcher() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Computes the Levenshtein distance: the minimum number of single character insertions, deletions and
     * substitutions turning {@code a} into {@code b}. Comparison is case-sensitive.
     *
     * @param a first string
     * @param b second string
     * @return the edit distance, {@code 0} when both strings are equal
     * @throws NullPointerException if either argument is null
     */
    public static int levenshteinDistance(String a, String b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.equals(b)) return 0;
        if (a.isEmpty()) return b.length();
        if (b.isEmpty()) return a.length();

        int[] previous = new int[a.length() + 1];
        int[] current = new int[a.length() + 1];
        for (int j = 0; j <= a.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= b.length(); i++) {
            current[0] = i;
            char bc = b.charAt(i - 1);
            for (int j = 1; j <= a.length(); j++) {
                if (a.charAt(j - 1) == bc) {
                    current[j] = previous[j - 1];
                } else {
                    current[j] = 1 + Math.min(previous[j - 1], Math.min(current[j - 1], previous[j]));
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        return previous[a.length()];
    }

    /**
     * Finds the candidate closest to {@code input}.
     * <p>
     * On ties the candidate appearing first wins. Comparison is case-sensitive; callers normalize first.
     * </p>
     *
     * @param input      the unknown name
     * @param candidates known names, in preference order
     * @param threshold  maximum accepted distance
     * @return the closest candidate within the threshold, or empty
     */
    public static Optional<String> closest(String input, Collection<String> candidates, int threshold) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;

        for (String candidate : candidates) {
            int distance = levenshteinDistance(input, candidate);
            if (distance < bestDistance && distance <= threshold) {
                bestDistance = distance;
                best = candidate;
            }
        }

        return Optional.ofNullable(best);
    }

    /**
     * Lists every candidate within {@code threshold} of {@code input}, ignoring case, closest first.
     * Candidates at the same distance keep their original order.
     *
     * @param input      the value typed by a user
     * @param candidates known values
     * @param threshold  maximum accepted distance
     * @param limit      maximum number of matches returned
     * @return matching candidates as given (original casing), at most {@code limit}
     */
    public static List<String> closestMatches(String input, Collection<String> candidates, int threshold, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        String needle = input.toLowerCase(Locale.ROOT);

        List<Match> matches = new ArrayList<>();
        for (String candidate : candidates) {
            int distance = levenshteinDistance(needle, candidate.toLowerCase(Locale.ROOT));
            if (distance <= threshold) {
                matches.add(new Match(candidate, distance));
            }
        }
        matches.sort(Comparator.comparingInt(Match::distance));

        return matches.stream().limit(limit).map(Match::value).toList();
    }

    private record Match(String value, int distance) {}
}
