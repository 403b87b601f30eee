package com.partsbin.core.match;

/**
 * Ratcliff/Obershelp ratio: twice the number of matching characters divided by the total length,
 * where matches are found by recursively taking the longest common block.
 */
public final class SequenceRatioScorer implements SimilarityScorer {

    @Override
    public double score(String left, String right) {
        String a = left == null ? "" : left;
        String b = right == null ? "" : right;
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, 0, a.length(), b, 0, b.length()) / total;
    }

    private int matchingCharacters(String a, int aLow, int aHigh, String b, int bLow, int bHigh) {
        if (aLow >= aHigh || bLow >= bHigh) {
            return 0;
        }
        int bestI = aLow;
        int bestJ = bLow;
        int bestSize = 0;
        // lengths of common suffixes ending at (i, j), one row at a time
        int[] previous = new int[bHigh - bLow + 1];
        for (int i = aLow; i < aHigh; i++) {
            int[] current = new int[bHigh - bLow + 1];
            for (int j = bLow; j < bHigh; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int size = previous[j - bLow] + 1;
                    current[j - bLow + 1] = size;
                    if (size > bestSize) {
                        bestSize = size;
                        bestI = i - size + 1;
                        bestJ = j - size + 1;
                    }
                }
            }
            previous = current;
        }
        if (bestSize == 0) {
            return 0;
        }
        return bestSize
            + matchingCharacters(a, aLow, bestI, b, bLow, bestJ)
            + matchingCharacters(a, bestI + bestSize, aHigh, b, bestJ + bestSize, bHigh);
    }
}
