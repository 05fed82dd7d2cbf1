package com.example.AusFin.util;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * ROUGE-1 and ROUGE-L F1 between a candidate answer and a reference.
 * Tokens are lower-cased words and numbers; thousands separators, trailing ".00" cents
 * and citation markers are removed so "$18,000" and "18000.00" compare equal.
 */
public final class RougeScorer {

    private RougeScorer() {
    }

    private static final Pattern CITATION = Pattern.compile("\\[P:[^\\]]*\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern THOUSANDS = Pattern.compile("(?<=\\d),(?=\\d{3}(?!\\d))");
    private static final Pattern SPLIT = Pattern.compile("[^\\p{L}\\p{N}.]+");
    private static final Pattern ZERO_CENTS = Pattern.compile("^(\\d+)\\.0+$");

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String cleaned = CITATION.matcher(text).replaceAll(" ");
        cleaned = THOUSANDS.matcher(cleaned).replaceAll("");
        List<String> tokens = new ArrayList<>();
        for (String raw : SPLIT.split(cleaned.toLowerCase(Locale.ROOT))) {
            String token = trimDots(raw);
            if (token.isEmpty()) {
                continue;
            }
            tokens.add(ZERO_CENTS.matcher(token).replaceFirst("$1"));
        }
        return tokens;
    }

    public static double rouge1(String candidate, String reference) {
        List<String> c = tokenize(candidate);
        List<String> r = tokenize(reference);
        if (c.isEmpty() || r.isEmpty()) {
            return 0.0;
        }
        Map<String, Integer> refCounts = counts(r);
        int overlap = 0;
        for (Map.Entry<String, Integer> entry : counts(c).entrySet()) {
            overlap += Math.min(entry.getValue(), refCounts.getOrDefault(entry.getKey(), 0));
        }
        return f1(overlap, c.size(), r.size());
    }

    public static double rougeL(String candidate, String reference) {
        List<String> c = tokenize(candidate);
        List<String> r = tokenize(reference);
        if (c.isEmpty() || r.isEmpty()) {
            return 0.0;
        }
        return f1(lcsLength(c, r), c.size(), r.size());
    }

    static int lcsLength(List<String> a, List<String> b) {
        int[] previous = new int[b.size() + 1];
        int[] current = new int[b.size() + 1];
        for (int i = 1; i <= a.size(); i++) {
            for (int j = 1; j <= b.size(); j++) {
                if (a.get(i - 1).equals(b.get(j - 1))) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.size()];
    }

    private static double f1(int overlap, int candidateLength, int referenceLength) {
        if (overlap == 0) {
            return 0.0;
        }
        double precision = (double) overlap / candidateLength;
        double recall = (double) overlap / referenceLength;
        return 2 * precision * recall / (precision + recall);
    }

    private static Map<String, Integer> counts(List<String> tokens) {
        Map<String, Integer> counts = new HashMap<>();
        for (String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        return counts;
    }

    private static String trimDots(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && token.charAt(start) == '.') {
            start++;
        }
        while (end > start && token.charAt(end - 1) == '.') {
            end--;
        }
        return token.substring(start, end);
    }
}
