package com.ledgerimport.common;

/**
 * Edit distance used by fuzzy duplicate matching.
 */
public final class StringDistance {

    private StringDistance() {
    }

    /**
     * Levenshtein distance (insert, delete, substitute each cost 1). Null is treated as empty.
     */
    public static int levenshtein(String a, String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;
        if (left.equals(right)) {
            return 0;
        }
        if (left.isEmpty()) {
            return right.length();
        }
        if (right.isEmpty()) {
            return left.length();
        }
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= left.length(); i++) {
            current[0] = i;
            char c = left.charAt(i - 1);
            for (int j = 1; j <= right.length(); j++) {
                int cost = c == right.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }
}
