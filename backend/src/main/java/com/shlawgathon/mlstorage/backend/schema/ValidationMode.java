package com.shlawgathon.mlstorage.backend.schema;

/**
 * What a candidate document is about to be used for.
 */
public enum ValidationMode {

    /**
     * A complete document about to be inserted. Flat field names, plain values only.
     */
    DOCUMENT,

    /**
     * Fields to set on an existing document. Dotted paths are allowed, operator
     * expressions are not.
     */
    UPDATE,

    /**
     * A query filter. Dotted paths and operator expressions are allowed, and
     * {@code tags} may be a single tag.
     */
    FILTER;

    public boolean allowsDottedPaths() {
        return this != DOCUMENT;
    }
}
