package com.calsim.dependency.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of analyzing one variable.
 *
 * A variable with no definition anywhere is reported through {@link #notFound(String)},
 * never as an error.
 */
@Value
@Builder(toBuilder = true)
public class DependencyAnalysis {

    @NonNull
    String variable;

    boolean found;

    @Singular("definition")
    List<DependencyRecord> defined;

    @Singular("input")
    List<DependencyRecord> inputs;

    @Singular("dependency")
    List<DependencyRecord> dependencies;

    /**
     * Rendered report text, present only when a report was requested.
     */
    String report;

    public static DependencyAnalysis notFound(String variable) {
        return DependencyAnalysis.builder()
                .variable(variable)
                .found(false)
                .build();
    }
}
