package com.calsim.dependency.parser;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * WRESL statement kinds that declare a named variable block.
 */
@Getter
@RequiredArgsConstructor
public enum StatementKind {
    DEFINE("define"),
    GOAL("goal");

    private final String keyword;
}
