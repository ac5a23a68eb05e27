package com.shlawgathon.mlstorage.backend.service;

import com.shlawgathon.mlstorage.backend.config.StorageProperties;
import com.shlawgathon.mlstorage.backend.model.Experiment;
import com.shlawgathon.mlstorage.backend.store.ExperimentQuery;
import com.shlawgathon.mlstorage.backend.store.ExperimentStore;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.shlawgathon.mlstorage.backend.schema.ExperimentFields.DELETED;
import static com.shlawgathon.mlstorage.backend.schema.ExperimentFields.ID;

/**
 * Periodically removes experiments that were marked deleted but never
 * physically removed, e.g. because the background purge failed.
 */
@Component
@ConditionalOnProperty(prefix = "mlstorage.purge", name = "enabled", havingValue = "true")
public class DeletedExperimentPurger {

    private static final Logger log = LoggerFactory.getLogger(DeletedExperimentPurger.class);

    private final ExperimentStore experimentStore;
    private final StorageProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public DeletedExperimentPurger(ExperimentStore experimentStore, StorageProperties properties) {
        this.experimentStore = experimentStore;
        this.properties = properties;
    }

    @Scheduled(
            initialDelayString = "${mlstorage.purge.initial-delay-ms:60000}",
            fixedDelayString = "${mlstorage.purge.interval-ms:300000}"
    )
    public void tick() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            long removed = purge();
            if (removed > 0) {
                log.info("[PURGE] Removed {} soft-deleted experiment(s)", removed);
            }
        } catch (RuntimeException e) {
            log.error("[PURGE] Sweep failed: {}", e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }

    /**
     * Hard-delete every soft-deleted experiment, one batch at a time.
     *
     * @return the number of documents removed
     */
    public long purge() {
        int batchSize = properties.getPurge().getBatchSize();
        ExperimentQuery query = ExperimentQuery.builder()
                .filter(Map.of(DELETED, true))
                .includeDeleted(true)
                .sortBy(Sort.by(ID))
                .limit(batchSize)
                .build();

        long removed = 0;
        while (true) {
            List<ObjectId> batch;
            try (Stream<Experiment> docs = experimentStore.iterDocs(query)) {
                batch = docs.map(Experiment::getId).collect(Collectors.toList());
            }
            if (batch.isEmpty()) {
                return removed;
            }
            long deleted = experimentStore.completeDeletion(batch);
            removed += deleted;
            if (batch.size() < batchSize || deleted == 0) {
                return removed;
            }
        }
    }
}
