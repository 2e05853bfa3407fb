package com.calsim.dependency.parser;

import java.util.Arrays;
import java.util.Objects;

/**
 * Maps character spans of a source text to 1-based line numbers.
 *
 * Line start offsets are computed once; lookups are binary searches.
 */
public class LineMapper {

    private final int[] lineStarts;

    public LineMapper(String text) {
        Objects.requireNonNull(text, "text");
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
    }

    /**
     * Lines covering {@code [start, end)}: the line holding {@code start} and the
     * line holding the span's last character.
     */
    public LineRange map(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
        int last = end > start ? end - 1 : start;
        return new LineRange(lineOf(start), lineOf(last));
    }

    public LineRange map(StatementMatch match) {
        return map(match.getStart(), match.getEnd());
    }

    public int lineOf(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        // not found: the insertion point is already the 1-based line number
        return idx >= 0 ? idx + 1 : -idx - 1;
    }
}
