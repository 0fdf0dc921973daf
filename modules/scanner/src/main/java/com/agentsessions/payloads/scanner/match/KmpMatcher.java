package com.agentsessions.payloads.scanner.match;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Knuth–Morris–Pratt matcher for one fixed byte pattern, advanced one byte at a time.
 *
 * <p>The matcher itself is immutable and shareable; the caller owns the match state, an
 * int in {@code [0, length()]}. Total work is linear in the number of bytes fed no matter
 * how many partial matches occur.
 */
public final class KmpMatcher {

    private final byte[] pattern;
    private final int[] failure;

    public KmpMatcher(byte[] pattern) {
        if (pattern == null || pattern.length == 0) {
            throw new IllegalArgumentException("Pattern must not be empty");
        }
        this.pattern = Arrays.copyOf(pattern, pattern.length);
        this.failure = buildFailureTable(this.pattern);
    }

    /**
     * Matcher for an ASCII literal.
     */
    public static KmpMatcher of(String literal) {
        return new KmpMatcher(literal.getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * Feeds one byte.
     *
     * @param state previous state, 0 for a fresh search
     * @return new state; equal to {@link #length()} when the pattern just completed
     */
    public int advance(int state, byte b) {
        int m = state;
        if (m == pattern.length) {
            m = failure[m - 1];
        }
        while (m > 0 && b != pattern[m]) {
            m = failure[m - 1];
        }
        if (b == pattern[m]) {
            m++;
        }
        return m;
    }

    public boolean isComplete(int state) {
        return state == pattern.length;
    }

    public int length() {
        return pattern.length;
    }

    private static int[] buildFailureTable(byte[] pattern) {
        int[] table = new int[pattern.length];
        int j = 0;
        for (int i = 1; i < pattern.length; i++) {
            while (j > 0 && pattern[i] != pattern[j]) {
                j = table[j - 1];
            }
            if (pattern[i] == pattern[j]) {
                j++;
            }
            table[i] = j;
        }
        return table;
    }
}
