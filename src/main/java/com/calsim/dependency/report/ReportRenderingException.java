package com.calsim.dependency.report;

/**
 * The dependency report template could not be loaded or processed.
 */
public class ReportRenderingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ReportRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
