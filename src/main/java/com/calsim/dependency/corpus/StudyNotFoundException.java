package com.calsim.dependency.corpus;

import java.nio.file.Path;

/**
 * The study directory to analyze does not exist or is not a directory.
 */
public class StudyNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StudyNotFoundException(Path studyDir) {
        super(studyDir + " not found.");
    }
}
