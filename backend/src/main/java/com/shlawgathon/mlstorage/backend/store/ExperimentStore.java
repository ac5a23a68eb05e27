package com.shlawgathon.mlstorage.backend.store;

import com.mongodb.client.result.UpdateResult;
import com.shlawgathon.mlstorage.backend.config.AsyncConfig;
import com.shlawgathon.mlstorage.backend.config.StorageProperties;
import com.shlawgathon.mlstorage.backend.exception.CascadeDeleteException;
import com.shlawgathon.mlstorage.backend.exception.ExperimentNotFoundException;
import com.shlawgathon.mlstorage.backend.exception.IllegalStatusTransitionException;
import com.shlawgathon.mlstorage.backend.model.Experiment;
import com.shlawgathon.mlstorage.backend.model.ExperimentStatus;
import com.shlawgathon.mlstorage.backend.schema.ExperimentDocValidator;
import com.shlawgathon.mlstorage.backend.schema.ValidationMode;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.BasicQuery;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.shlawgathon.mlstorage.backend.schema.ExperimentFields.*;

/**
 * MongoDB store for experiment documents.
 *
 * <p>Every experiment is one document in the configured collection. Callers address
 * it by {@code id}; inside MongoDB the same value lives in {@code _id}. Fields the
 * schema does not know about are stored as-is.
 *
 * <p>Each operation checks its arguments, makes sure the collection indexes exist,
 * shapes the document through the {@link ExperimentDocValidator}, and then issues
 * a single-document MongoDB operation. There are no multi-document transactions:
 * deletion is a soft mark on a whole experiment tree followed, some time later, by
 * {@link #completeDeletion(Collection)}.
 */
@Component
public class ExperimentStore {

    private static final Logger log = LoggerFactory.getLogger(ExperimentStore.class);

    private static final Sort DEFAULT_SORT = Sort.by(Sort.Direction.DESC, HEARTBEAT);

    private final MongoTemplate mongoTemplate;
    private final ExperimentDocValidator validator;
    private final ExperimentDocumentMapper mapper;
    private final Executor deletionExecutor;
    private final Clock clock;
    private final String collectionName;
    private final ExperimentIndexManager indexManager;

    @Autowired
    public ExperimentStore(MongoTemplate mongoTemplate,
            ExperimentDocValidator validator,
            ExperimentDocumentMapper mapper,
            @Qualifier(AsyncConfig.DELETION_EXECUTOR) Executor deletionExecutor,
            Clock clock,
            StorageProperties properties) {
        this(mongoTemplate, validator, mapper, deletionExecutor, clock, properties.getCollection());
    }

    public ExperimentStore(MongoTemplate mongoTemplate,
            ExperimentDocValidator validator,
            ExperimentDocumentMapper mapper,
            Executor deletionExecutor,
            Clock clock,
            String collectionName) {
        this.mongoTemplate = mongoTemplate;
        this.validator = validator;
        this.mapper = mapper;
        this.deletionExecutor = deletionExecutor;
        this.clock = clock;
        this.collectionName = collectionName;
        this.indexManager = new ExperimentIndexManager(() -> mongoTemplate.getCollection(collectionName));
    }

    public String getCollectionName() {
        return collectionName;
    }

    /**
     * Make sure the experiment indexes exist. Only the first successful call
     * on this store does any work.
     */
    public void ensureIndexes() {
        indexManager.ensureIndexes();
    }

    public boolean isIndexesEnsured() {
        return indexManager.isEnsured();
    }

    /**
     * Get an experiment by id.
     *
     * @return the experiment, or empty if it does not exist or is marked deleted
     */
    public Optional<Experiment> get(Object id) {
        ObjectId experimentId = validator.validateId(id);
        ensureIndexes();
        Document doc = mongoTemplate.findOne(activeExperiment(experimentId), Document.class, collectionName);
        return Optional.ofNullable(doc)
                .map(ExperimentIds::fromDatabase)
                .map(mapper::fromDocument);
    }

    /**
     * Create an experiment.
     *
     * <p>Any {@code id} in {@code fields} is ignored. When absent, {@code start_time}
     * defaults to now, {@code heartbeat} to {@code start_time} and {@code status}
     * to RUNNING. Names need not be unique.
     *
     * @return the id assigned to the new experiment
     */
    public ObjectId create(String name, Map<String, Object> fields) {
        if (name == null) {
            throw new IllegalArgumentException("Experiment name must not be null");
        }
        Map<String, Object> candidate = ExperimentIds.stripIds(copyOf(fields));
        candidate.put(NAME, name);
        Map<String, Object> doc = validator.validateDocument(candidate, ValidationMode.DOCUMENT);

        if (doc.get(START_TIME) == null) {
            doc.put(START_TIME, now());
        }
        if (doc.get(HEARTBEAT) == null) {
            doc.put(HEARTBEAT, doc.get(START_TIME));
        }
        if (doc.get(STATUS) == null) {
            doc.put(STATUS, ExperimentStatus.RUNNING.name());
        }
        ensureIndexes();

        ObjectId id = new ObjectId();
        Document document = new Document(DATABASE_ID, id);
        document.putAll(doc);
        mongoTemplate.insert(document, collectionName);
        log.debug("Created experiment {} ({})", id, name);
        return id;
    }

    public ObjectId create(String name) {
        return create(name, null);
    }

    /**
     * Set the given fields on an experiment. Fields not mentioned are left alone.
     * An empty payload does nothing and does not check that the experiment exists.
     *
     * @throws ExperimentNotFoundException       if no non-deleted experiment has this id
     * @throws IllegalStatusTransitionException if the payload changes the status of a finished experiment
     */
    public void update(Object id, Map<String, Object> fields) {
        ObjectId experimentId = validator.validateId(id);
        Map<String, Object> doc = shapeUpdate(fields);
        ensureIndexes();
        if (!doc.isEmpty()) {
            applyUpdate(experimentId, doc);
        }
    }

    /**
     * Set the heartbeat of an experiment to now, along with any other given fields.
     *
     * @throws ExperimentNotFoundException if no non-deleted experiment has this id
     */
    public void setHeartbeat(Object id, Map<String, Object> fields) {
        ObjectId experimentId = validator.validateId(id);
        Map<String, Object> doc = shapeUpdate(fields);
        doc.put(HEARTBEAT, now());
        ensureIndexes();
        applyUpdate(experimentId, doc);
    }

    public void setHeartbeat(Object id) {
        setHeartbeat(id, null);
    }

    /**
     * Finish an experiment: {@code status} is set to the given terminal value and
     * {@code stop_time} and {@code heartbeat} to now.
     *
     * @throws IllegalArgumentException         if {@code status} is not COMPLETED or FAILED
     * @throws ExperimentNotFoundException      if no non-deleted experiment has this id
     * @throws IllegalStatusTransitionException if the experiment already finished with the other status
     */
    public void setFinished(Object id, ExperimentStatus status, Map<String, Object> fields) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Invalid status: " + status);
        }
        ObjectId experimentId = validator.validateId(id);
        Map<String, Object> doc = shapeUpdate(fields);
        Date now = now();
        doc.put(STOP_TIME, now);
        doc.put(HEARTBEAT, now);
        doc.put(STATUS, status.name());
        ensureIndexes();
        applyUpdate(experimentId, doc);
    }

    /**
     * Same as {@link #setFinished(Object, ExperimentStatus, Map)}, with the status given by name.
     *
     * @throws IllegalArgumentException if {@code status} is not "COMPLETED" or "FAILED"
     */
    public void setFinished(Object id, String status, Map<String, Object> fields) {
        ExperimentStatus parsed;
        try {
            parsed = ExperimentStatus.valueOf(String.valueOf(status));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid status: " + status, e);
        }
        setFinished(id, parsed, fields);
    }

    /**
     * Set the deletion flag on an experiment and all of its descendants.
     *
     * <p>The tree is walked depth-first, parent before children, children in id
     * order. Already-deleted experiments are marked again and their children are
     * still visited, so repeated calls re-walk the whole subtree.
     *
     * @return the ids marked, in visit order; empty if the experiment does not exist
     * @throws CascadeDeleteException if MongoDB fails partway; marks already set stay
     */
    public List<ObjectId> markDelete(Object id) {
        ObjectId rootId = validator.validateId(id);
        ensureIndexes();

        List<ObjectId> marked = new ArrayList<>();
        Set<ObjectId> visited = new HashSet<>();
        Deque<ObjectId> pending = new ArrayDeque<>();
        pending.push(rootId);
        try {
            while (!pending.isEmpty()) {
                ObjectId current = pending.pop();
                if (!visited.add(current)) {
                    log.warn("Experiment {} reached twice while deleting {}, parent_id cycle?", current, rootId);
                    continue;
                }
                UpdateResult result = mongoTemplate.updateFirst(
                        Query.query(Criteria.where(DATABASE_ID).is(current)),
                        Update.update(DELETED, true),
                        collectionName);
                if (result.getMatchedCount() < 1) {
                    continue;
                }
                marked.add(current);

                List<ObjectId> children = findChildIds(current);
                for (int i = children.size() - 1; i >= 0; i--) {
                    pending.push(children.get(i));
                }
            }
        } catch (DataAccessException e) {
            throw new CascadeDeleteException(rootId, marked, e);
        }

        if (!marked.isEmpty()) {
            log.info("Marked {} experiment(s) as deleted under {}", marked.size(), rootId);
        }
        return marked;
    }

    /**
     * Permanently remove the given experiments. Duplicates are ignored and ids
     * that no longer exist count as zero. The deletes run concurrently; if any of
     * them fails, the failure is rethrown once all of them have finished.
     *
     * @return the number of documents actually removed
     */
    public long completeDeletion(Collection<?> ids) {
        Set<ObjectId> unique = new LinkedHashSet<>();
        for (Object id : ids) {
            unique.add(validator.validateId(id));
        }
        ensureIndexes();

        List<CompletableFuture<Long>> tasks = unique.stream()
                .map(id -> CompletableFuture.supplyAsync(() -> deleteOne(id), deletionExecutor))
                .collect(Collectors.toList());
        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }

        long deleted = tasks.stream().mapToLong(CompletableFuture::join).sum();
        log.info("Removed {} of {} experiment(s)", deleted, unique.size());
        return deleted;
    }

    /**
     * Stream the experiments matching a query.
     *
     * <p>The stream reads from a MongoDB cursor as it is consumed, can be consumed
     * only once, and must be closed.
     */
    public Stream<Experiment> iterDocs(ExperimentQuery query) {
        Map<String, Object> filter = ExperimentIds.toDatabase(
                validator.validateDocument(copyOf(query.getFilter()), ValidationMode.FILTER));
        if (!query.isIncludeDeleted()) {
            filter.put(DELETED, new Document("$ne", true));
        }

        Query mongoQuery = new BasicQuery(new Document(filter)).with(toDatabaseSort(query.getSortBy()));
        if (query.getSkip() != null && query.getSkip() > 0) {
            mongoQuery.skip(query.getSkip());
        }
        if (query.getLimit() != null && query.getLimit() > 0) {
            mongoQuery.limit(query.getLimit());
        }
        ensureIndexes();

        return mongoTemplate.stream(mongoQuery, Document.class, collectionName)
                .map(ExperimentIds::fromDatabase)
                .map(mapper::fromDocument);
    }

    public Stream<Experiment> iterDocs() {
        return iterDocs(ExperimentQuery.all());
    }

    /**
     * Fetch all experiments matching a query into a list.
     */
    public List<Experiment> fetchDocs(ExperimentQuery query) {
        try (Stream<Experiment> docs = iterDocs(query)) {
            return docs.collect(Collectors.toList());
        }
    }

    public List<Experiment> fetchDocs() {
        return fetchDocs(ExperimentQuery.all());
    }

    private Map<String, Object> shapeUpdate(Map<String, Object> fields) {
        return validator.validateDocument(ExperimentIds.stripIds(copyOf(fields)), ValidationMode.UPDATE);
    }

    private void applyUpdate(ObjectId id, Map<String, Object> fields) {
        Update update = new Update();
        fields.forEach(update::set);
        Query query = activeExperiment(id);
        List<String> blocked = blockedCurrentStatuses(fields);
        if (!blocked.isEmpty()) {
            query.addCriteria(Criteria.where(STATUS).nin(blocked));
        }
        UpdateResult result = mongoTemplate.updateFirst(query, update, collectionName);
        if (result.getMatchedCount() < 1) {
            if (!blocked.isEmpty() && mongoTemplate.exists(activeExperiment(id), collectionName)) {
                throw new IllegalStatusTransitionException(id, fields.get(STATUS));
            }
            throw new ExperimentNotFoundException(id);
        }
        log.debug("Updated experiment {}: {}", id, fields.keySet());
    }

    /**
     * Terminal statuses an experiment must not currently have for the status in
     * {@code fields} to be written. Empty when the update leaves status alone.
     */
    private static List<String> blockedCurrentStatuses(Map<String, Object> fields) {
        if (!fields.containsKey(STATUS)) {
            return List.of();
        }
        Object target = fields.get(STATUS);
        List<String> blocked = new ArrayList<>();
        for (ExperimentStatus status : ExperimentStatus.values()) {
            if (status.isTerminal() && !status.name().equals(target)) {
                blocked.add(status.name());
            }
        }
        return blocked;
    }

    private Query activeExperiment(ObjectId id) {
        return Query.query(Criteria.where(DATABASE_ID).is(id).and(DELETED).ne(true));
    }

    private List<ObjectId> findChildIds(ObjectId parentId) {
        Query query = Query.query(Criteria.where(PARENT_ID).is(parentId))
                .with(Sort.by(Sort.Direction.ASC, DATABASE_ID));
        query.fields().include(DATABASE_ID);
        return mongoTemplate.find(query, Document.class, collectionName).stream()
                .map(doc -> doc.getObjectId(DATABASE_ID))
                .collect(Collectors.toList());
    }

    private long deleteOne(ObjectId id) {
        return mongoTemplate.remove(Query.query(Criteria.where(DATABASE_ID).is(id)), collectionName)
                .getDeletedCount();
    }

    private Sort toDatabaseSort(Sort sort) {
        if (sort == null || sort.isUnsorted()) {
            return DEFAULT_SORT;
        }
        return Sort.by(sort.stream()
                .map(order -> order.withProperty(ExperimentIds.toDatabaseField(order.getProperty())))
                .collect(Collectors.toList()));
    }

    private Date now() {
        return Date.from(clock.instant().truncatedTo(ChronoUnit.MILLIS));
    }

    private static Map<String, Object> copyOf(Map<String, Object> fields) {
        return fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>();
    }
}
