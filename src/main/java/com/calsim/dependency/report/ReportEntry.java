package com.calsim.dependency.report;

import com.calsim.dependency.model.DependencyRecord;
import com.calsim.dependency.parser.LineRange;

import lombok.Value;

/**
 * One report line: the variable and where it was found.
 */
@Value
public class ReportEntry {
    String variable;
    String citation;

    public static ReportEntry of(DependencyRecord record) {
        return new ReportEntry(record.getVariable(), cite(record.getLines(), record.getFile()));
    }

    /**
     * {@code Line 4 of a.wresl} or {@code Lines 4 - 9 of a.wresl}.
     */
    static String cite(LineRange lines, String file) {
        if (lines.isSingleLine()) {
            return "Line " + lines.getStart() + " of " + file;
        }
        return "Lines " + lines.getStart() + " - " + lines.getEnd() + " of " + file;
    }
}
