package com.shlawgathon.mlstorage.backend.exception;

/**
 * Thrown when an experiment identifier is not a valid ObjectId.
 */
public class InvalidExperimentIdException extends ExperimentValidationException {

    private final transient Object rejectedValue;

    public InvalidExperimentIdException(Object rejectedValue) {
        this("id", rejectedValue);
    }

    public InvalidExperimentIdException(String field, Object rejectedValue) {
        super(field, "invalid experiment id: " + rejectedValue);
        this.rejectedValue = rejectedValue;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
