package org.novelfinder.search.text;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ratcliff/Obershelp similarity between two strings.
 *
 * <p>The ratio is {@code 2 * M / T}, where {@code T} is the total number of code points in both
 * strings and {@code M} the number of code points in the matching blocks found by recursively
 * taking the longest common substring and repeating on both sides of it. Two empty strings have
 * a ratio of {@code 1.0}.</p>
 *
 * <p>When {@code b} has 200 or more code points, elements occurring in more than 1% of it are
 * not used to seed matches, though matches may still be extended through them.</p>
 */
public final class SequenceMatcher {
    private static final int AUTOJUNK_MIN_LENGTH = 200;

    private final int[] a;
    private final int[] b;
    private final Map<Integer, List<Integer>> b2j;

    public SequenceMatcher(String a, String b) {
        this.a = a.codePoints().toArray();
        this.b = b.codePoints().toArray();
        this.b2j = indexOf(this.b);
    }

    public static double ratio(String a, String b) {
        return new SequenceMatcher(a, b).ratio();
    }

    public double ratio() {
        int total = a.length + b.length;
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCodePoints() / total;
    }

    /** Total size of all matching blocks. */
    public int matchingCodePoints() {
        int matched = 0;
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length, 0, b.length});
        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int alo = range[0], ahi = range[1], blo = range[2], bhi = range[3];
            int[] match = findLongestMatch(alo, ahi, blo, bhi);
            int i = match[0], j = match[1], k = match[2];
            if (k == 0) {
                continue;
            }
            matched += k;
            if (alo < i && blo < j) {
                queue.push(new int[]{alo, i, blo, j});
            }
            if (i + k < ahi && j + k < bhi) {
                queue.push(new int[]{i + k, ahi, j + k, bhi});
            }
        }
        return matched;
    }

    /**
     * Longest block {@code a[i:i+k] == b[j:j+k]} within the given ranges. Among blocks of equal
     * size the one starting earliest in {@code a}, then earliest in {@code b}, wins.
     */
    int[] findLongestMatch(int alo, int ahi, int blo, int bhi) {
        int besti = alo;
        int bestj = blo;
        int bestSize = 0;

        Map<Integer, Integer> j2len = new HashMap<>();
        for (int i = alo; i < ahi; i++) {
            Map<Integer, Integer> nextJ2len = new HashMap<>();
            for (int j : b2j.getOrDefault(a[i], List.of())) {
                if (j < blo) {
                    continue;
                }
                if (j >= bhi) {
                    break;
                }
                int k = j2len.getOrDefault(j - 1, 0) + 1;
                nextJ2len.put(j, k);
                if (k > bestSize) {
                    besti = i - k + 1;
                    bestj = j - k + 1;
                    bestSize = k;
                }
            }
            j2len = nextJ2len;
        }

        while (besti > alo && bestj > blo && a[besti - 1] == b[bestj - 1]) {
            besti--;
            bestj--;
            bestSize++;
        }
        while (besti + bestSize < ahi && bestj + bestSize < bhi && a[besti + bestSize] == b[bestj + bestSize]) {
            bestSize++;
        }
        return new int[]{besti, bestj, bestSize};
    }

    private static Map<Integer, List<Integer>> indexOf(int[] sequence) {
        Map<Integer, List<Integer>> index = new HashMap<>();
        for (int j = 0; j < sequence.length; j++) {
            index.computeIfAbsent(sequence[j], key -> new ArrayList<>()).add(j);
        }
        if (sequence.length >= AUTOJUNK_MIN_LENGTH) {
            int popularity = sequence.length / 100 + 1;
            index.values().removeIf(positions -> positions.size() > popularity);
        }
        return index;
    }
}
