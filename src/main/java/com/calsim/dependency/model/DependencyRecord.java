package com.calsim.dependency.model;

import com.calsim.dependency.parser.LineRange;

import lombok.NonNull;
import lombok.Value;

/**
 * One finding of an analysis: a definition, input or dependent location.
 *
 * {@code spanStart}/{@code spanEnd} are the statement's character offsets in its file.
 */
@Value
public class DependencyRecord {

    @NonNull
    String variable;

    @NonNull
    String file;

    @NonNull
    LineRange lines;

    int spanStart;
    int spanEnd;
}
