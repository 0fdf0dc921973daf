package com.agentsessions.payloads.scanner.json;

/**
 * Extent of a {@link StringClass#LARGE_VALUE} string, recorded without buffering its bytes.
 *
 * @param contentOffset  offset of the first byte after the opening quote
 * @param endQuoteOffset offset of the closing quote
 * @param valid          false when the raw bytes contained a backslash escape
 * @param lineIndex      newline count before the opening quote
 */
public record LargeString(long contentOffset, long endQuoteOffset, boolean valid, long lineIndex) {

    /**
     * Raw byte length between the quotes.
     */
    public int length() {
        return (int) Math.min(Integer.MAX_VALUE, endQuoteOffset - contentOffset);
    }

    /**
     * True for a non-empty string free of escapes, i.e. a usable base64 candidate.
     */
    public boolean usable() {
        return valid && endQuoteOffset > contentOffset;
    }
}
