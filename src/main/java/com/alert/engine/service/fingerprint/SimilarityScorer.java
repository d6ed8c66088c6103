package com.alert.engine.service.fingerprint;

import org.springframework.stereotype.Component;

/**
 * Normalized edit-distance similarity between fingerprints.
 */
@Component
public class SimilarityScorer {

    /**
     * Returns {@code 1 - levenshtein(a, b) / max(|a|, |b|)}, in [0, 1]. Null counts as empty.
     */
    public double similarity(String a, String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;
        if (left.equals(right)) {
            return 1.0;
        }
        int longest = Math.max(left.length(), right.length());
        return 1.0 - (double) levenshtein(left, right) / longest;
    }

    int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
