package com.expansion.leads.similarity;

import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Token-set similarity on a 0-100 scale.
 *
 * <p>Both inputs are upper-cased and split on whitespace into token sets. Shared tokens count in
 * full, so "ACME ROBOTICS" against "ACME ROBOTICS UK" scores 100. Otherwise the score is the best
 * indel ratio among: shared+onlyA vs shared+onlyB, shared vs shared+onlyA, shared vs shared+onlyB,
 * each side's tokens sorted and space-joined.</p>
 */
public class TokenSetSimilarity implements NameSimilarity {

    /**
     * Floored to an integer.
     */
    @Override
    public int ratio(String s1, String s2) {
        SortedSet<String> tokensA = tokenize(s1);
        SortedSet<String> tokensB = tokenize(s2);
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0;
        }

        SortedSet<String> intersection = new TreeSet<>(tokensA);
        intersection.retainAll(tokensB);
        SortedSet<String> diffAB = new TreeSet<>(tokensA);
        diffAB.removeAll(tokensB);
        SortedSet<String> diffBA = new TreeSet<>(tokensB);
        diffBA.removeAll(tokensA);

        if (!intersection.isEmpty() && (diffAB.isEmpty() || diffBA.isEmpty())) {
            return 100;
        }

        String diffABJoined = String.join(" ", diffAB);
        String diffBAJoined = String.join(" ", diffBA);
        int abLen = diffABJoined.length();
        int baLen = diffBAJoined.length();
        int sectLen = String.join(" ", intersection).length();
        int separator = sectLen != 0 ? 1 : 0;

        int sectABLen = sectLen + separator + abLen;
        int sectBALen = sectLen + separator + baLen;

        // The shared prefix contributes no edits, so only the differing tails are compared.
        int distance = IndelDistance.distance(diffABJoined, diffBAJoined);
        double result = IndelDistance.normalizedSimilarity(distance, sectABLen + sectBALen);

        if (sectLen == 0) {
            return (int) Math.floor(result);
        }

        double sectABRatio = IndelDistance.normalizedSimilarity(separator + abLen, sectLen + sectABLen);
        double sectBARatio = IndelDistance.normalizedSimilarity(separator + baLen, sectLen + sectBALen);

        return (int) Math.floor(Math.max(result, Math.max(sectABRatio, sectBARatio)));
    }

    private static SortedSet<String> tokenize(String s) {
        SortedSet<String> tokens = new TreeSet<>();
        if (s == null) {
            return tokens;
        }
        for (String token : s.toUpperCase(Locale.ROOT).trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
