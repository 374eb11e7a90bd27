package com.expansion.leads.resolution;

/**
 * Outcome of matching a free-text name against the registry.
 * A sub-threshold best candidate is reported as no match: empty identifier, score 0.
 *
 * @param identifier   registry number of the matched entity, or empty
 * @param score        confidence, 0 to 100
 * @param matchedTitle registry title of the match, or empty
 */
public record ResolutionResult(String identifier, int score, String matchedTitle) {

    private static final ResolutionResult NO_MATCH = new ResolutionResult("", 0, "");

    public ResolutionResult {
        identifier = identifier != null ? identifier : "";
        matchedTitle = matchedTitle != null ? matchedTitle : "";
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be between 0 and 100");
        }
        if (identifier.isEmpty() && score != 0) {
            throw new IllegalArgumentException("An empty identifier must carry score 0");
        }
    }

    public static ResolutionResult noMatch() {
        return NO_MATCH;
    }

    public boolean isMatch() {
        return !identifier.isEmpty();
    }
}
