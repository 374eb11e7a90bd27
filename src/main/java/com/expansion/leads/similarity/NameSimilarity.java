package com.expansion.leads.similarity;

/**
 * Scores how alike two organisation names are, on an integer 0-100 scale.
 * Blank input on either side scores 0. Implementations are symmetric and stateless.
 */
public interface NameSimilarity {

    int ratio(String left, String right);

    /**
     * True when {@link #ratio} reaches {@code threshold}.
     */
    default boolean matches(String left, String right, int threshold) {
        return ratio(left, right) >= threshold;
    }
}
