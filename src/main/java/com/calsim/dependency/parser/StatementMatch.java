package com.calsim.dependency.parser;

import lombok.Value;

/**
 * A located {@code <kind> <name> { ... }} block: its kind and its character span
 * {@code [start, end)} in the text it was found in.
 */
@Value
public class StatementMatch {
    StatementKind kind;
    int start;
    int end;

    public String slice(String text) {
        return text.substring(start, end);
    }
}
