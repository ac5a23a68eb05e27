package com.shlawgathon.mlstorage.backend.store;

import com.shlawgathon.mlstorage.backend.BaseE2ETest;
import com.shlawgathon.mlstorage.backend.exception.ExperimentNotFoundException;
import com.shlawgathon.mlstorage.backend.exception.ExperimentValidationException;
import com.shlawgathon.mlstorage.backend.exception.IllegalStatusTransitionException;
import com.shlawgathon.mlstorage.backend.model.Experiment;
import com.shlawgathon.mlstorage.backend.model.ExperimentStatus;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentStoreE2ETest extends BaseE2ETest {

    @Autowired
    private ExperimentStore experimentStore;

    @Autowired
    private MongoTemplate mongoTemplate;

    @BeforeEach
    void setUp() {
        mongoTemplate.remove(new Query(), experimentStore.getCollectionName());
    }

    @Test
    void shouldCreateRunningExperiment() {
        // When
        ObjectId id = experimentStore.create("train-v1", Map.of("description", "baseline run"));

        // Then
        Experiment experiment = experimentStore.get(id).orElseThrow();
        assertEquals(id, experiment.getId());
        assertEquals("train-v1", experiment.getName());
        assertEquals("baseline run", experiment.getDescription());
        assertEquals(ExperimentStatus.RUNNING, experiment.getStatus());
        assertNotNull(experiment.getStartTime());
        assertEquals(experiment.getStartTime(), experiment.getHeartbeat());
        assertFalse(experiment.isSoftDeleted());
    }

    @Test
    void shouldAllowDuplicateNames() {
        ObjectId first = experimentStore.create("sweep");
        ObjectId second = experimentStore.create("sweep");

        assertNotEquals(first, second);
        assertEquals(2, experimentStore.fetchDocs(ExperimentQuery.builder()
                .filter(Map.of("name", "sweep"))
                .build()).size());
    }

    @Test
    void shouldPreserveUnknownFields() {
        ObjectId id = experimentStore.create("custom", Map.of(
                "cluster", Map.of("gpu", "A100", "nodes", 4),
                "owner", "alice"));

        Experiment experiment = experimentStore.get(id).orElseThrow();

        assertEquals("alice", experiment.getExtra().get("owner"));
        assertEquals(Map.of("gpu", "A100", "nodes", 4), experiment.getExtra().get("cluster"));
    }

    @Test
    void shouldReturnEmptyForMissingExperiment() {
        assertTrue(experimentStore.get(new ObjectId()).isEmpty());
        assertTrue(experimentStore.get(new ObjectId().toHexString()).isEmpty());
    }

    @Test
    void shouldMergeUpdates() {
        // Given
        ObjectId id = experimentStore.create("train", Map.of("config", Map.of("lr", 0.1)));

        // When
        experimentStore.update(id, Map.of("description", "tuned", "result.loss", 0.25));

        // Then
        Experiment experiment = experimentStore.get(id).orElseThrow();
        assertEquals("tuned", experiment.getDescription());
        assertEquals(Map.of("lr", 0.1), experiment.getConfig());
        assertEquals(Map.of("loss", 0.25), experiment.getResult());
        assertEquals("train", experiment.getName());
    }

    @Test
    void shouldRejectInvalidUpdateWithoutWriting() {
        ObjectId id = experimentStore.create("train");

        assertThrows(ExperimentValidationException.class,
                () -> experimentStore.update(id, Map.of("description", "ok", "status", "PAUSED")));

        assertNull(experimentStore.get(id).orElseThrow().getDescription());
    }

    @Test
    void shouldNotUpdateMissingOrDeletedExperiment() {
        ObjectId deleted = experimentStore.create("gone");
        experimentStore.markDelete(deleted);

        assertThrows(ExperimentNotFoundException.class,
                () -> experimentStore.update(new ObjectId(), Map.of("description", "x")));
        assertThrows(ExperimentNotFoundException.class,
                () -> experimentStore.update(deleted, Map.of("description", "x")));
        assertThrows(ExperimentNotFoundException.class,
                () -> experimentStore.setHeartbeat(deleted));
        assertThrows(ExperimentNotFoundException.class,
                () -> experimentStore.setFinished(deleted, ExperimentStatus.COMPLETED, Map.of()));
    }

    @Test
    void shouldAdvanceHeartbeat() throws InterruptedException {
        ObjectId id = experimentStore.create("train");
        Experiment before = experimentStore.get(id).orElseThrow();
        Thread.sleep(5);

        experimentStore.setHeartbeat(id, Map.of("result", Map.of("step", 100)));

        Experiment after = experimentStore.get(id).orElseThrow();
        assertTrue(after.getHeartbeat().isAfter(before.getHeartbeat()));
        assertEquals(before.getStartTime(), after.getStartTime());
        assertEquals(Map.of("step", 100), after.getResult());
    }

    @Test
    void shouldFinishExperiment() {
        ObjectId id = experimentStore.create("train");

        experimentStore.setFinished(id, "FAILED", Map.of(
                "error", Map.of("message", "CUDA out of memory"),
                "exit_code", 1));

        Experiment experiment = experimentStore.get(id).orElseThrow();
        assertEquals(ExperimentStatus.FAILED, experiment.getStatus());
        assertEquals("CUDA out of memory", experiment.getError().getMessage());
        assertEquals(1, experiment.getExitCode());
        assertNotNull(experiment.getStopTime());
        assertEquals(experiment.getStopTime(), experiment.getHeartbeat());
    }

    @Test
    void shouldNotReopenFinishedExperiment() {
        ObjectId id = experimentStore.create("train");
        experimentStore.setFinished(id, ExperimentStatus.COMPLETED, null);

        assertThrows(IllegalStatusTransitionException.class,
                () -> experimentStore.update(id, Map.of("status", "RUNNING")));
        assertThrows(IllegalStatusTransitionException.class,
                () -> experimentStore.setFinished(id, ExperimentStatus.FAILED, null));
        experimentStore.setFinished(id, ExperimentStatus.COMPLETED, Map.of("exit_code", 0));

        assertEquals(ExperimentStatus.COMPLETED, experimentStore.get(id).orElseThrow().getStatus());
    }

    @Test
    void shouldKeepExtraErrorKeys() {
        ObjectId id = experimentStore.create("train");
        experimentStore.setFinished(id, "FAILED", Map.of("error", Map.of("code", 137, "message", "oom")));

        Experiment experiment = experimentStore.get(id).orElseThrow();
        assertEquals("oom", experiment.getError().getMessage());
        assertEquals(Map.of("code", 137), experiment.getError().getExtra());
    }

    @Test
    void shouldMarkWholeTreeDeleted() {
        // Given
        ObjectId root = experimentStore.create("root");
        ObjectId c1 = experimentStore.create("c1", Map.of("parent_id", root));
        ObjectId c2 = experimentStore.create("c2", Map.of("parent_id", root.toHexString()));
        ObjectId g = experimentStore.create("g", Map.of("parent_id", c1));
        ObjectId unrelated = experimentStore.create("unrelated");

        // When
        List<ObjectId> marked = experimentStore.markDelete(root);

        // Then
        assertEquals(List.of(root, c1, g, c2), marked);
        for (ObjectId id : marked) {
            assertTrue(experimentStore.get(id).isEmpty());
        }
        assertTrue(experimentStore.get(unrelated).isPresent());
    }

    @Test
    void shouldRewalkAlreadyDeletedSubtree() {
        ObjectId root = experimentStore.create("root");
        ObjectId child = experimentStore.create("child", Map.of("parent_id", root));
        experimentStore.markDelete(child);

        assertEquals(List.of(root, child), experimentStore.markDelete(root));
        assertEquals(List.of(root, child), experimentStore.markDelete(root));
    }

    @Test
    void shouldReturnEmptyListWhenMarkingMissingExperiment() {
        assertEquals(List.of(), experimentStore.markDelete(new ObjectId()));
    }

    @Test
    void shouldCompleteDeletionOnce() {
        ObjectId root = experimentStore.create("root");
        experimentStore.create("child", Map.of("parent_id", root));
        List<ObjectId> marked = experimentStore.markDelete(root);

        List<Object> withDuplicates = new ArrayList<>(marked);
        withDuplicates.add(marked.get(0).toHexString());

        assertEquals(2, experimentStore.completeDeletion(withDuplicates));
        assertEquals(0, experimentStore.completeDeletion(withDuplicates));
        assertTrue(experimentStore.fetchDocs(ExperimentQuery.builder().includeDeleted(true).build()).isEmpty());
    }

    @Test
    void shouldListDeletedExperimentsOnlyOnRequest() {
        // Given
        ObjectId e1 = experimentStore.create("train-v1");
        ObjectId e2 = experimentStore.create("train-v1-fold0", Map.of("parent_id", e1));
        ObjectId other = experimentStore.create("other");

        // When
        assertEquals(List.of(e1, e2), experimentStore.markDelete(e1));

        // Then
        assertTrue(experimentStore.get(e1).isEmpty());
        assertTrue(experimentStore.get(e2).isEmpty());

        List<Experiment> visible = experimentStore.fetchDocs();
        assertEquals(List.of(other), ids(visible));
        assertTrue(visible.stream().noneMatch(Experiment::isSoftDeleted));

        List<Experiment> all = experimentStore.fetchDocs(ExperimentQuery.builder().includeDeleted(true).build());
        assertEquals(Set.of(e1, e2, other), Set.copyOf(ids(all)));
        assertTrue(all.stream().filter(e -> !e.getId().equals(other)).allMatch(Experiment::isSoftDeleted));
    }

    @Test
    void shouldNotLetFilterRevealDeletedExperiments() {
        ObjectId id = experimentStore.create("hidden");
        experimentStore.markDelete(id);

        List<Experiment> docs = experimentStore.fetchDocs(ExperimentQuery.builder()
                .filter(Map.of("deleted", true))
                .build());

        assertTrue(docs.isEmpty());
    }

    @Test
    void shouldSortByHeartbeatDescendingByDefault() {
        ObjectId older = experimentStore.create("older", Map.of("heartbeat", "2024-01-01T00:00:00Z"));
        ObjectId newest = experimentStore.create("newest", Map.of("heartbeat", "2024-03-01T00:00:00Z"));
        ObjectId middle = experimentStore.create("middle", Map.of("heartbeat", "2024-02-01T00:00:00Z"));

        assertEquals(List.of(newest, middle, older), ids(experimentStore.fetchDocs()));
    }

    @Test
    void shouldFilterSortAndPage() {
        List<ObjectId> created = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            created.add(experimentStore.create("run-" + i, Map.of("tags", List.of("sweep"))));
        }
        experimentStore.create("unrelated", Map.of("tags", List.of("baseline")));

        List<Experiment> page = experimentStore.fetchDocs(ExperimentQuery.builder()
                .filter(Map.of("tags", "sweep"))
                .sortBy(Sort.by(Sort.Direction.ASC, "id"))
                .skip(1)
                .limit(2)
                .build());

        assertEquals(created.subList(1, 3), ids(page));
    }

    @Test
    void shouldFilterById() {
        ObjectId id = experimentStore.create("target");
        experimentStore.create("other");

        List<Experiment> docs = experimentStore.fetchDocs(ExperimentQuery.builder()
                .filter(Map.of("id", id.toHexString()))
                .build());

        assertEquals(List.of(id), ids(docs));
    }

    @Test
    void shouldStreamLazily() {
        for (int i = 0; i < 3; i++) {
            experimentStore.create("run-" + i);
        }

        try (Stream<Experiment> docs = experimentStore.iterDocs()) {
            assertEquals(1, docs.limit(1).count());
        }
    }

    @Test
    void shouldCreateIndexes() {
        experimentStore.create("train");

        assertTrue(experimentStore.isIndexesEnsured());
        List<Document> keys = mongoTemplate.getCollection(experimentStore.getCollectionName())
                .listIndexes().into(new ArrayList<>()).stream()
                .map(info -> info.get("key", Document.class))
                .collect(Collectors.toList());
        for (Document required : ExperimentIndexManager.REQUIRED_INDEXES) {
            assertTrue(keys.stream().anyMatch(key -> ExperimentIndexManager.sameKeySpec(key, required)),
                    "missing index " + required.toJson());
        }
    }

    private static List<ObjectId> ids(List<Experiment> experiments) {
        return experiments.stream().map(Experiment::getId).collect(Collectors.toList());
    }
}
