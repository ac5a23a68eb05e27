package com.shlawgathon.mlstorage.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the experiment store, bound from {@code mlstorage.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "mlstorage")
public class StorageProperties {

    /**
     * MongoDB collection holding the experiment documents.
     */
    @NotBlank
    private String collection = "experiments";

    @Valid
    private Deletion deletion = new Deletion();

    @Valid
    private Purge purge = new Purge();

    @Data
    public static class Deletion {

        /**
         * Number of hard deletes issued concurrently.
         */
        @Min(1)
        private int parallelism = 4;
    }

    @Data
    public static class Purge {

        /**
         * Periodically hard-delete experiments left soft-deleted.
         */
        private boolean enabled = false;

        @Min(1)
        private int batchSize = 500;

        @Min(1)
        private long intervalMs = 300_000;

        @Min(0)
        private long initialDelayMs = 60_000;
    }
}
