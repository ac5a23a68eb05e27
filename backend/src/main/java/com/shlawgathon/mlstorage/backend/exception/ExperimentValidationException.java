package com.shlawgathon.mlstorage.backend.exception;

/**
 * Thrown when an experiment document or filter does not pass validation.
 * Nothing has been written when this is raised.
 */
public class ExperimentValidationException extends RuntimeException {

    private final String field;

    public ExperimentValidationException(String message) {
        this(null, message);
    }

    public ExperimentValidationException(String field, String message) {
        super(field != null ? field + ": " + message : message);
        this.field = field;
    }

    /**
     * Name of the offending field, or {@code null} if the failure is not tied to one.
     */
    public String getField() {
        return field;
    }
}
