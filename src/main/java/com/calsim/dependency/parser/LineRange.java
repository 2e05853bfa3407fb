package com.calsim.dependency.parser;

import lombok.Value;

/**
 * Inclusive, 1-based line range.
 */
@Value
public class LineRange {
    int start;
    int end;

    public boolean isSingleLine() {
        return start == end;
    }
}
