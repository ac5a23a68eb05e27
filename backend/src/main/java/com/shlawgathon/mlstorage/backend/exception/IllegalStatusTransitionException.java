package com.shlawgathon.mlstorage.backend.exception;

import org.bson.types.ObjectId;

/**
 * Thrown when a write would move a finished experiment out of its terminal status.
 */
public class IllegalStatusTransitionException extends IllegalStateException {

    private final ObjectId experimentId;
    private final Object targetStatus;

    public IllegalStatusTransitionException(ObjectId experimentId, Object targetStatus) {
        super("Experiment " + experimentId + " is already finished, cannot set status to " + targetStatus);
        this.experimentId = experimentId;
        this.targetStatus = targetStatus;
    }

    public ObjectId getExperimentId() {
        return experimentId;
    }

    public Object getTargetStatus() {
        return targetStatus;
    }
}
