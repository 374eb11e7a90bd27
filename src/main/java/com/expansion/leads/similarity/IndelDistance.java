package com.expansion.leads.similarity;

/**
 * Insertion/deletion edit distance (no substitutions), derived from the longest common subsequence.
 */
final class IndelDistance {

    private IndelDistance() {
    }

    static int distance(String s1, String s2) {
        return s1.length() + s2.length() - 2 * longestCommonSubsequence(s1, s2);
    }

    /**
     * Normalized similarity on a 0-100 scale: {@code 100 * (1 - distance / lengthSum)}.
     */
    static double normalizedSimilarity(int distance, int lengthSum) {
        if (lengthSum == 0) {
            return 100.0;
        }
        return 100.0 * (1.0 - (double) distance / lengthSum);
    }

    /**
     * Two-row dynamic programming; O(min(m,n)) space.
     */
    private static int longestCommonSubsequence(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int n = s2.length();

        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int j = 1; j <= n; j++) {
            currentRow[0] = 0;
            for (int i = 1; i <= m; i++) {
                if (s1.charAt(i - 1) == s2.charAt(j - 1)) {
                    currentRow[i] = previousRow[i - 1] + 1;
                } else {
                    currentRow[i] = Math.max(currentRow[i - 1], previousRow[i]);
                }
            }

            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}
