package com.shlawgathon.mlstorage.backend.schema;

import com.shlawgathon.mlstorage.backend.exception.ExperimentValidationException;
import com.shlawgathon.mlstorage.backend.exception.InvalidExperimentIdException;
import org.bson.types.ObjectId;

import java.util.Map;

/**
 * Shapes candidate experiment documents before they reach MongoDB.
 */
public interface ExperimentDocValidator {

    /**
     * Validate a candidate document.
     *
     * @param candidate the caller's fields, never modified
     * @param mode      whether the fields form a new document, an update or a filter
     * @return a new map holding the shaped fields
     * @throws ExperimentValidationException if a field breaks the rules
     */
    Map<String, Object> validateDocument(Map<String, Object> candidate, ValidationMode mode);

    /**
     * Convert an experiment identifier to its native form.
     *
     * @throws InvalidExperimentIdException if the value is not a valid ObjectId
     */
    ObjectId validateId(Object id);
}
