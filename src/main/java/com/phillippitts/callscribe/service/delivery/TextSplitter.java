package com.phillippitts.callscribe.service.delivery;

import com.phillippitts.callscribe.util.LogSanitizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits report text into parts that fit a chat platform's message size limit.
 */
public final class TextSplitter {

    /** A newline is used as the cut point only when it lies past this share of the budget. */
    static final double MIN_NEWLINE_CUT_RATIO = 0.6;

    private TextSplitter() {
    }

    /**
     * Strips control characters (newline and tab kept) and cuts the text into parts of at most
     * {@code maxChars}. Each cut happens at the last newline before the budget when that newline
     * lies beyond 60% of it, otherwise exactly at the budget.
     *
     * @return non-empty parts in order; empty list for blank input
     */
    public static List<String> split(String text, int maxChars) {
        if (maxChars < 1) {
            throw new IllegalArgumentException("maxChars must be >= 1");
        }
        String rest = LogSanitizer.stripControlChars(text).strip();
        List<String> parts = new ArrayList<>();
        while (!rest.isEmpty()) {
            if (rest.length() <= maxChars) {
                parts.add(rest);
                break;
            }
            int cut = rest.lastIndexOf('\n', maxChars);
            if (cut < maxChars * MIN_NEWLINE_CUT_RATIO) {
                cut = maxChars;
            }
            String part = rest.substring(0, cut).strip();
            if (!part.isEmpty()) {
                parts.add(part);
            }
            rest = rest.substring(cut).strip();
        }
        return parts;
    }
}
