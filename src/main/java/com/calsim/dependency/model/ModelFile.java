package com.calsim.dependency.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One WRESL file of a study: its path relative to the study root and its raw text.
 */
@Value
public class ModelFile {

    @NonNull
    String path;

    @NonNull
    String content;
}
