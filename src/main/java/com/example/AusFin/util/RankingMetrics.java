package com.example.AusFin.util;

import java.util.List;
import java.util.Map;

/**
 * Ranking metrics over graded relevance (0 = irrelevant, 3 = highly relevant).
 * Gain is the grade itself, discount is log2(rank + 1).
 */
public final class RankingMetrics {

    private RankingMetrics() {
    }

    public static double ndcgAtK(List<String> ranked, Map<String, Integer> grades, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive");
        }
        double ideal = idealDcg(grades, k);
        if (ideal == 0.0) {
            return 0.0;
        }
        return dcgAtK(ranked, grades, k) / ideal;
    }

    public static double dcgAtK(List<String> ranked, Map<String, Integer> grades, int k) {
        double dcg = 0.0;
        int limit = Math.min(k, ranked.size());
        for (int i = 0; i < limit; i++) {
            int grade = grade(grades, ranked.get(i));
            if (grade > 0) {
                dcg += grade / log2(i + 2);
            }
        }
        return dcg;
    }

    public static double idealDcg(Map<String, Integer> grades, int k) {
        List<Integer> ideal = grades.values().stream()
                .filter(g -> g != null && g > 0)
                .sorted((a, b) -> Integer.compare(b, a))
                .limit(k)
                .toList();
        double dcg = 0.0;
        for (int i = 0; i < ideal.size(); i++) {
            dcg += ideal.get(i) / log2(i + 2);
        }
        return dcg;
    }

    /**
     * 1 / rank of the first relevant passage, 0 when none was retrieved.
     */
    public static double reciprocalRank(List<String> ranked, Map<String, Integer> grades) {
        for (int i = 0; i < ranked.size(); i++) {
            if (grade(grades, ranked.get(i)) > 0) {
                return 1.0 / (i + 1);
            }
        }
        return 0.0;
    }

    public static double recallAtK(List<String> ranked, Map<String, Integer> grades, int k) {
        long relevant = grades.values().stream().filter(g -> g != null && g > 0).count();
        if (relevant == 0) {
            return 0.0;
        }
        long found = ranked.stream()
                .limit(k)
                .filter(id -> grade(grades, id) > 0)
                .count();
        return (double) found / relevant;
    }

    private static int grade(Map<String, Integer> grades, String id) {
        Integer grade = grades.get(id);
        return grade == null ? 0 : grade;
    }

    private static double log2(int value) {
        return Math.log(value) / Math.log(2);
    }
}
