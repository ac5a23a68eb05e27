package com.shlawgathon.mlstorage.backend.store;

import java.util.Map;

import static com.shlawgathon.mlstorage.backend.schema.ExperimentFields.DATABASE_ID;
import static com.shlawgathon.mlstorage.backend.schema.ExperimentFields.ID;

/**
 * Renames the experiment identifier between the caller-facing {@code id}
 * and MongoDB's {@code _id}. All methods modify the given map in place.
 */
public final class ExperimentIds {

    private ExperimentIds() {
    }

    /**
     * Remove both {@code id} and {@code _id} from the document.
     */
    public static <M extends Map<String, Object>> M stripIds(M doc) {
        if (doc != null) {
            doc.remove(DATABASE_ID);
            doc.remove(ID);
        }
        return doc;
    }

    /**
     * Rename {@code id} to {@code _id}, for documents and filters sent to MongoDB.
     */
    public static <M extends Map<String, Object>> M toDatabase(M doc) {
        if (doc != null && doc.containsKey(ID)) {
            doc.put(DATABASE_ID, doc.remove(ID));
        }
        return doc;
    }

    /**
     * Rename {@code _id} to {@code id}, for documents read from MongoDB.
     */
    public static <M extends Map<String, Object>> M fromDatabase(M doc) {
        if (doc != null && doc.containsKey(DATABASE_ID)) {
            doc.put(ID, doc.remove(DATABASE_ID));
        }
        return doc;
    }

    /**
     * Map a single caller-facing field name, e.g. a sort property.
     */
    public static String toDatabaseField(String field) {
        return ID.equals(field) ? DATABASE_ID : field;
    }
}
