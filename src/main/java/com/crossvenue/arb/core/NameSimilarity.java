package com.crossvenue.arb.core;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Participant name similarity in [0, 1]. Names that resolve through the alias table compare
 * exactly; otherwise the better of token Jaccard and character-bigram Dice is used.
 */
public class NameSimilarity {

    private final TeamAliasResolver aliases;

    public NameSimilarity(TeamAliasResolver aliases) {
        this.aliases = aliases;
    }

    public double score(String sport, String a, String b) {
        if (a == null || b == null || a.isBlank() || b.isBlank()) {
            return 0.0;
        }
        var ca = aliases.resolve(sport, a);
        var cb = aliases.resolve(sport, b);
        if (ca.isPresent() && cb.isPresent()) {
            return ca.get().equals(cb.get()) ? 1.0 : 0.0;
        }

        String na = TeamAliasResolver.normalize(ca.orElse(a));
        String nb = TeamAliasResolver.normalize(cb.orElse(b));
        if (na.equals(nb)) {
            return 1.0;
        }
        return Math.max(jaccard(na, nb), dice(na, nb));
    }

    static double jaccard(String a, String b) {
        Set<String> ta = tokens(a);
        Set<String> tb = tokens(b);
        if (ta.isEmpty() || tb.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(ta);
        intersection.retainAll(tb);
        Set<String> union = new HashSet<>(ta);
        union.addAll(tb);
        return (double) intersection.size() / union.size();
    }

    static double dice(String a, String b) {
        Map<String, Integer> ba = bigrams(a);
        Map<String, Integer> bb = bigrams(b);
        int total = ba.values().stream().mapToInt(Integer::intValue).sum()
                + bb.values().stream().mapToInt(Integer::intValue).sum();
        if (total == 0) {
            return 0.0;
        }
        int overlap = 0;
        for (Map.Entry<String, Integer> e : ba.entrySet()) {
            overlap += Math.min(e.getValue(), bb.getOrDefault(e.getKey(), 0));
        }
        return 2.0 * overlap / total;
    }

    private static Set<String> tokens(String s) {
        return Arrays.stream(s.split(" ")).filter(t -> !t.isEmpty()).collect(Collectors.toSet());
    }

    private static Map<String, Integer> bigrams(String s) {
        String compact = s.replace(" ", "");
        Map<String, Integer> grams = new HashMap<>();
        for (int i = 0; i + 1 < compact.length(); i++) {
            grams.merge(compact.substring(i, i + 2), 1, Integer::sum);
        }
        return grams;
    }
}
