package com.shlawgathon.mlstorage.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure detail attached to a FAILED experiment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExperimentError {

    /**
     * Short message describing the failure.
     */
    private String message;

    /**
     * Full traceback, optional.
     */
    private String traceback;

    /**
     * Any other keys stored in the error sub-document, e.g. an error code.
     */
    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();
}
