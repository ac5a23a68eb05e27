package com.shlawgathon.mlstorage.backend.model;

/**
 * Status of an experiment run.
 * RUNNING is the initial state, COMPLETED and FAILED are terminal.
 */
public enum ExperimentStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
