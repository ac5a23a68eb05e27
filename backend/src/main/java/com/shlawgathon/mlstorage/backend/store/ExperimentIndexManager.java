package com.shlawgathon.mlstorage.backend.store;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.IndexModel;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.shlawgathon.mlstorage.backend.schema.ExperimentFields.*;

/**
 * Makes sure the experiment collection carries its secondary indexes.
 *
 * The check runs at most once per instance: after the first successful pass the
 * instance stays "ensured" for its lifetime. The flag is not synchronized, so
 * concurrent first callers may both run the pass; index creation in MongoDB is
 * idempotent for identical specs, which makes that harmless. Two instances
 * against the same collection are not coordinated either.
 */
public class ExperimentIndexManager {

    private static final Logger log = LoggerFactory.getLogger(ExperimentIndexManager.class);

    public static final List<Document> REQUIRED_INDEXES = List.of(
            new Document(PARENT_ID, 1),
            new Document(NAME, 1),
            new Document(TAGS, 1),
            new Document(STATUS, 1),
            new Document(FINGERPRINT, 1),
            new Document(ARGS, 1),
            new Document(DELETED, 1),
            new Document(START_TIME, -1),
            new Document(STOP_TIME, -1),
            new Document(HEARTBEAT, -1));

    private final Supplier<MongoCollection<Document>> collection;
    private final List<Document> requiredIndexes;

    private volatile boolean indexesEnsured = false;

    public ExperimentIndexManager(Supplier<MongoCollection<Document>> collection) {
        this(collection, REQUIRED_INDEXES);
    }

    public ExperimentIndexManager(Supplier<MongoCollection<Document>> collection, List<Document> requiredIndexes) {
        this.collection = collection;
        this.requiredIndexes = List.copyOf(requiredIndexes);
    }

    /**
     * Create the missing indexes, unless this instance already did so.
     * Failures propagate and leave the instance "not yet ensured".
     */
    public void ensureIndexes() {
        if (indexesEnsured) {
            return;
        }
        ensureIndexes(collection.get(), requiredIndexes);
        indexesEnsured = true;
    }

    public boolean isEnsured() {
        return indexesEnsured;
    }

    /**
     * Create every index of {@code required} whose key spec no existing index
     * matches exactly, in one bulk call.
     *
     * @return the number of indexes created
     */
    static int ensureIndexes(MongoCollection<Document> collection, List<Document> required) {
        if (required.isEmpty()) {
            return 0;
        }
        List<Document> existingKeys = new ArrayList<>();
        for (Document info : collection.listIndexes().into(new ArrayList<>())) {
            Document key = info.get("key", Document.class);
            if (key != null) {
                existingKeys.add(key);
            }
        }

        List<IndexModel> missing = new ArrayList<>();
        for (Document keys : required) {
            boolean present = existingKeys.stream().anyMatch(existing -> sameKeySpec(existing, keys));
            if (!present) {
                missing.add(new IndexModel(keys));
            }
        }

        if (!missing.isEmpty()) {
            collection.createIndexes(missing);
            log.info("Created {} experiment index(es): {}", missing.size(),
                    missing.stream().map(m -> m.getKeys().toString()).collect(Collectors.joining(", ")));
        }
        return missing.size();
    }

    /**
     * Two key specs match when they list the same fields in the same order with
     * the same directions. Numeric directions compare by value (1 == 1.0).
     */
    static boolean sameKeySpec(Document existing, Document required) {
        if (existing.size() != required.size()) {
            return false;
        }
        Iterator<Map.Entry<String, Object>> a = existing.entrySet().iterator();
        Iterator<Map.Entry<String, Object>> b = required.entrySet().iterator();
        while (a.hasNext()) {
            Map.Entry<String, Object> left = a.next();
            Map.Entry<String, Object> right = b.next();
            if (!left.getKey().equals(right.getKey()) || !sameDirection(left.getValue(), right.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean sameDirection(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return l.doubleValue() == r.doubleValue();
        }
        return Objects.equals(left, right);
    }
}
