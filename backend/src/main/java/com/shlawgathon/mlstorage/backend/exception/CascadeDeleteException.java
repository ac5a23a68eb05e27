package com.shlawgathon.mlstorage.backend.exception;

import org.bson.types.ObjectId;

import java.util.List;

/**
 * Thrown when marking an experiment tree as deleted fails partway.
 * The experiments listed in {@link #getMarkedIds()} keep their deletion flag;
 * the rest of the tree is untouched.
 */
public class CascadeDeleteException extends RuntimeException {

    private final ObjectId rootId;
    private final List<ObjectId> markedIds;

    public CascadeDeleteException(ObjectId rootId, List<ObjectId> markedIds, Throwable cause) {
        super("Failed to mark experiment tree " + rootId + " as deleted after "
                + markedIds.size() + " experiment(s): " + cause.getMessage(), cause);
        this.rootId = rootId;
        this.markedIds = List.copyOf(markedIds);
    }

    public ObjectId getRootId() {
        return rootId;
    }

    public List<ObjectId> getMarkedIds() {
        return markedIds;
    }
}
