package com.shlawgathon.mlstorage.backend.store;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Sort;

import java.util.Map;

/**
 * Parameters of an experiment listing. Every property is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExperimentQuery {

    /**
     * Field constraints, keyed by caller-facing field name. Values are literals
     * or operator expressions such as {@code {"$in": [...]}}.
     */
    private Map<String, Object> filter;

    /**
     * Documents to skip at the front; ignored unless positive.
     */
    private Integer skip;

    /**
     * Maximum number of documents; ignored unless positive.
     */
    private Integer limit;

    /**
     * Sort order, {@code heartbeat} descending when absent.
     */
    private Sort sortBy;

    /**
     * Also return experiments whose deletion flag is set.
     */
    @Builder.Default
    private boolean includeDeleted = false;

    public static ExperimentQuery all() {
        return ExperimentQuery.builder().build();
    }
}
