package com.projectcontext.core.similarity;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores how well a free-text query names a project.
 *
 * <p>Scores are in {@code [0, 1]}, deterministic and symmetric. Only strings that
 * are equal after {@link #normalize(String) normalization} score {@code 1.0};
 * every other pair is capped at {@value #MAX_INEXACT}.
 *
 * <p>The score is the highest of:
 * <ul>
 *   <li>LCS ratio {@code 2 * LCS / (|a| + |b|)} (the baseline)</li>
 *   <li>containment: baseline + 0.25 * shorter/longer</li>
 *   <li>subsequence: baseline + 0.2, or + 0.35 when the shorter string spells the
 *       initials of the longer one's tokens</li>
 *   <li>token overlap with Jaccard index at least 0.5: baseline + 0.3 * Jaccard</li>
 * </ul>
 */
public final class SimilarityEngine {

    public static final double MAX_INEXACT = 0.99;

    private static final Pattern SEPARATORS = Pattern.compile("[-_\\s]+");
    private static final String SEPARATOR = "-";

    private static final double CONTAINMENT_BONUS = 0.25;
    private static final double SUBSEQUENCE_BONUS = 0.2;
    private static final double INITIALS_BONUS = 0.35;
    private static final double TOKEN_BONUS = 0.3;
    private static final double MIN_JACCARD = 0.5;
    private static final int MIN_SUBSEQUENCE_LENGTH = 2;

    private SimilarityEngine() {
        // Utility class
    }

    /**
     * Scores {@code query} against {@code target}.
     *
     * @param query query string, may be null
     * @param target target string, may be null
     * @return similarity in [0, 1]; 0 when either side is null or blank
     */
    public static double score(String query, String target) {
        String a = normalize(query);
        String b = normalize(target);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }

        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        double baseline = lcsRatio(a, b);
        double best = baseline;

        if (a.contains(b) || b.contains(a)) {
            best = Math.max(best, baseline + CONTAINMENT_BONUS * shorter.length() / longer.length());
        }

        String compactA = a.replace(SEPARATOR, "");
        String compactB = b.replace(SEPARATOR, "");
        if (isAbbreviation(compactA, compactB) || isAbbreviation(compactB, compactA)) {
            boolean initials = spellsInitials(a, b) || spellsInitials(b, a);
            best = Math.max(best, baseline + (initials ? INITIALS_BONUS : SUBSEQUENCE_BONUS));
        }

        double jaccard = jaccard(tokens(a), tokens(b));
        if (jaccard >= MIN_JACCARD) {
            best = Math.max(best, baseline + TOKEN_BONUS * jaccard);
        }

        return Math.min(best, MAX_INEXACT);
    }

    /**
     * Lower-cases, trims and collapses runs of {@code -}, {@code _} and whitespace
     * into a single {@code -}.
     *
     * @param value raw value, may be null
     * @return normalized value, empty for null
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String collapsed = SEPARATORS.matcher(value.trim().toLowerCase(Locale.ROOT)).replaceAll(SEPARATOR);
        int start = 0;
        int end = collapsed.length();
        while (start < end && collapsed.charAt(start) == '-') {
            start++;
        }
        while (end > start && collapsed.charAt(end - 1) == '-') {
            end--;
        }
        return collapsed.substring(start, end);
    }

    static double lcsRatio(String a, String b) {
        return 2.0 * longestCommonSubsequence(a, b) / (a.length() + b.length());
    }

    static int longestCommonSubsequence(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                current[j] = a.charAt(i - 1) == b.charAt(j - 1)
                    ? previous[j - 1] + 1
                    : Math.max(previous[j], current[j - 1]);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * True when {@code abbreviation} is an in-order subsequence of {@code full}
     * starting with the same character.
     */
    private static boolean isAbbreviation(String abbreviation, String full) {
        if (abbreviation.length() < MIN_SUBSEQUENCE_LENGTH || abbreviation.length() > full.length()) {
            return false;
        }
        if (abbreviation.charAt(0) != full.charAt(0)) {
            return false;
        }
        int j = 0;
        for (int i = 0; i < full.length() && j < abbreviation.length(); i++) {
            if (full.charAt(i) == abbreviation.charAt(j)) {
                j++;
            }
        }
        return j == abbreviation.length();
    }

    private static boolean spellsInitials(String candidate, String full) {
        List<String> fullTokens = Arrays.asList(full.split(SEPARATOR));
        if (fullTokens.size() < MIN_SUBSEQUENCE_LENGTH) {
            return false;
        }
        String initials = fullTokens.stream()
            .map(token -> token.substring(0, 1))
            .collect(Collectors.joining());
        return candidate.replace(SEPARATOR, "").equals(initials);
    }

    private static Set<String> tokens(String normalized) {
        return new HashSet<>(Arrays.asList(normalized.split(SEPARATOR)));
    }

    private static double jaccard(Set<String> a, Set<String> b) {
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return union.isEmpty() ? 0.0 : (double) intersection.size() / union.size();
    }
}
