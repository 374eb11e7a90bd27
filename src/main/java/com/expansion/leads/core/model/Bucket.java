package com.expansion.leads.core.model;

/**
 * Discrete priority tier derived from the score. Declared from highest to lowest.
 */
public enum Bucket {
    HOT,
    MEDIUM,
    WATCH;

    /**
     * Threshold ladder: HOT at or above {@code hotThreshold}, MEDIUM at or above
     * {@code mediumThreshold}, otherwise WATCH.
     */
    public static Bucket fromScore(int score, int hotThreshold, int mediumThreshold) {
        if (score >= hotThreshold) {
            return HOT;
        }
        if (score >= mediumThreshold) {
            return MEDIUM;
        }
        return WATCH;
    }
}
