package com.expansion.leads.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Bounded score with its bucket and the rationale trail, in the order contributions were applied.
 */
public record ScoreResult(int score, Bucket bucket, List<String> rationale) {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;
    public static final int MAX_RATIONALE = 7;

    public ScoreResult {
        if (score < MIN_SCORE || score > MAX_SCORE) {
            throw new IllegalArgumentException("Score must be between 0 and 100, got " + score);
        }
        Objects.requireNonNull(bucket, "bucket is required");
        rationale = rationale != null ? List.copyOf(rationale) : List.of();
        if (rationale.size() > MAX_RATIONALE) {
            throw new IllegalArgumentException("At most " + MAX_RATIONALE + " rationale entries");
        }
    }

    public static int clamp(int raw) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, raw));
    }

    /**
     * Rationale joined for single-line display.
     */
    public String rationaleText() {
        return String.join("; ", rationale);
    }
}
