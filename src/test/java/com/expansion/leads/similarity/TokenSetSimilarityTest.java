package com.expansion.leads.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TokenSetSimilarity Tests")
class TokenSetSimilarityTest {

    private final TokenSetSimilarity similarity = new TokenSetSimilarity();

    @ParameterizedTest
    @CsvSource({
            "'ACME ROBOTICS', 'ACME ROBOTICS'",
            "'ACME ROBOTICS', 'ACME ROBOTICS UK'",
            "'robotics acme', 'ACME ROBOTICS'",
            "'acme', 'acme widgets international'"
    })
    @DisplayName("A token subset scores 100")
    void subsetScoresFull(String a, String b) {
        assertEquals(100, similarity.ratio(a, b));
    }

    @Test
    void emptyInputScoresZero() {
        assertEquals(0, similarity.ratio("", "ACME"));
        assertEquals(0, similarity.ratio("ACME", null));
    }

    @Test
    void disjointNamesScoreLow() {
        assertTrue(similarity.ratio("ALPHA", "OMEGA") < 50);
    }

    @Test
    void partialOverlapIsBetweenBounds() {
        int score = similarity.ratio("ACME ROBOTICS LIMITED", "ACME WIDGETS");
        assertTrue(score > 0 && score < 100, "score=" + score);
    }

    @Test
    void symmetric() {
        assertEquals(similarity.ratio("NORTHERN WIDGETS", "NORTH WIDGET CO"),
                similarity.ratio("NORTH WIDGET CO", "NORTHERN WIDGETS"));
    }

    @Test
    void matchesUsesInclusiveThreshold() {
        NameSimilarity names = similarity;
        assertTrue(names.matches("acme", "ACME", 100));
        assertFalse(names.matches("ALPHA", "OMEGA", 50));
    }
}
