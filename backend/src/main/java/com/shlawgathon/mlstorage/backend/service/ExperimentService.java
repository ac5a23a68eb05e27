package com.shlawgathon.mlstorage.backend.service;

import com.shlawgathon.mlstorage.backend.config.AsyncConfig;
import com.shlawgathon.mlstorage.backend.store.ExperimentStore;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Deletes experiment trees: marks them synchronously, then removes them
 * from MongoDB in the background.
 */
@Service
public class ExperimentService {

    private static final Logger log = LoggerFactory.getLogger(ExperimentService.class);

    private final ExperimentStore experimentStore;
    private final Executor purgeExecutor;

    public ExperimentService(ExperimentStore experimentStore,
            @Qualifier(AsyncConfig.PURGE_EXECUTOR) Executor purgeExecutor) {
        this.experimentStore = experimentStore;
        this.purgeExecutor = purgeExecutor;
    }

    /**
     * Delete an experiment and all of its descendants.
     *
     * Once this returns, none of the experiments is visible to default reads.
     * Physical removal happens asynchronously; if it fails, or cannot be scheduled,
     * {@code purged} completes exceptionally and the experiments stay soft-deleted
     * until {@link DeletedExperimentPurger} picks them up.
     */
    public ExperimentDeletion deleteExperiment(Object id) {
        List<ObjectId> marked = experimentStore.markDelete(id);
        if (marked.isEmpty()) {
            return new ExperimentDeletion(marked, CompletableFuture.completedFuture(0L));
        }

        CompletableFuture<Long> scheduled;
        try {
            scheduled = CompletableFuture.supplyAsync(() -> experimentStore.completeDeletion(marked), purgeExecutor);
        } catch (RejectedExecutionException e) {
            // TaskRejectedException from a saturated ThreadPoolTaskExecutor lands here too
            log.warn("[DELETE] Purge executor full, {} experiment(s) under {} left soft-deleted",
                    marked.size(), marked.get(0));
            return new ExperimentDeletion(marked, CompletableFuture.failedFuture(e));
        }
        CompletableFuture<Long> purged = scheduled
                .whenComplete((count, error) -> {
                    if (error != null) {
                        log.error("[DELETE] Hard deletion of {} experiment(s) under {} failed, left soft-deleted",
                                marked.size(), marked.get(0), error);
                    } else {
                        log.info("[DELETE] Removed {} of {} experiment(s) under {}", count, marked.size(), marked.get(0));
                    }
                });
        return new ExperimentDeletion(marked, purged);
    }

    /**
     * Result of {@link #deleteExperiment(Object)}.
     *
     * @param markedIds ids marked as deleted, root first
     * @param purged    completes with the number of documents physically removed
     */
    public record ExperimentDeletion(List<ObjectId> markedIds, CompletableFuture<Long> purged) {
    }
}
