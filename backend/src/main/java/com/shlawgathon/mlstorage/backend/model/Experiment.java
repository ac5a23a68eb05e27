package com.shlawgathon.mlstorage.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of an experiment document.
 *
 * Known fields are exposed as properties. Anything else found in the stored
 * document is kept verbatim in {@link #extra}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Experiment {

    private ObjectId id;

    private ObjectId parentId;

    private String name;
    private String description;
    private List<String> tags;

    // Timing (UTC)
    private Instant startTime;
    private Instant stopTime;
    private Instant heartbeat;

    private ExperimentStatus status;
    private ExperimentError error;

    // Free-form run metadata
    private Integer exitCode;
    private String storageDir;
    private Long storageSize;
    private Map<String, Object> excInfo;
    private Map<String, Object> webui;
    private String fingerprint;
    private Object args;
    private Map<String, Object> config;
    private Map<String, Object> defaultConfig;
    private Map<String, Object> result;

    private Boolean deleted;

    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    public boolean isSoftDeleted() {
        return Boolean.TRUE.equals(deleted);
    }
}
