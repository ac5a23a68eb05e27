package com.shlawgathon.mlstorage.backend.exception;

import org.bson.types.ObjectId;

/**
 * Thrown by mutating operations when no non-deleted experiment has the given id.
 */
public class ExperimentNotFoundException extends RuntimeException {

    private final ObjectId experimentId;

    public ExperimentNotFoundException(ObjectId experimentId) {
        super("Experiment not found: " + experimentId);
        this.experimentId = experimentId;
    }

    public ObjectId getExperimentId() {
        return experimentId;
    }
}
