package com.shlawgathon.mlstorage.backend.store;

import com.shlawgathon.mlstorage.backend.model.Experiment;
import com.shlawgathon.mlstorage.backend.model.ExperimentError;
import com.shlawgathon.mlstorage.backend.model.ExperimentStatus;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static com.shlawgathon.mlstorage.backend.schema.ExperimentFields.*;

/**
 * Builds the typed {@link Experiment} view from a document read from MongoDB
 * (already renamed to the caller-facing {@code id}).
 *
 * <p>Nothing stored is dropped: a known field whose stored value does not fit
 * its property type stays in {@link Experiment#getExtra()} under its own name.
 */
@Component
public class ExperimentDocumentMapper {

    private static final Logger log = LoggerFactory.getLogger(ExperimentDocumentMapper.class);

    public Experiment fromDocument(Map<String, Object> doc) {
        if (doc == null) {
            return null;
        }
        Map<String, Object> remaining = new LinkedHashMap<>(doc);

        Experiment experiment = new Experiment();
        experiment.setId(take(remaining, ID, this::asObjectId));
        experiment.setParentId(take(remaining, PARENT_ID, this::asObjectId));
        experiment.setName(take(remaining, NAME, this::asString));
        experiment.setDescription(take(remaining, DESCRIPTION, this::asString));
        experiment.setTags(take(remaining, TAGS, this::asStringList));
        experiment.setStartTime(take(remaining, START_TIME, this::asInstant));
        experiment.setStopTime(take(remaining, STOP_TIME, this::asInstant));
        experiment.setHeartbeat(take(remaining, HEARTBEAT, this::asInstant));
        experiment.setStatus(take(remaining, STATUS, value -> asStatus(experiment.getId(), value)));
        experiment.setError(take(remaining, ERROR, this::asError));
        experiment.setExitCode(take(remaining, EXIT_CODE, this::asInteger));
        experiment.setStorageDir(take(remaining, STORAGE_DIR, this::asString));
        experiment.setStorageSize(take(remaining, STORAGE_SIZE, this::asLong));
        experiment.setExcInfo(take(remaining, EXC_INFO, this::asMap));
        experiment.setWebui(take(remaining, WEBUI, this::asMap));
        experiment.setFingerprint(take(remaining, FINGERPRINT, this::asString));
        experiment.setArgs(remaining.remove(ARGS));
        experiment.setConfig(take(remaining, CONFIG, this::asMap));
        experiment.setDefaultConfig(take(remaining, DEFAULT_CONFIG, this::asMap));
        experiment.setResult(take(remaining, RESULT, this::asMap));
        experiment.setDeleted(take(remaining, DELETED, value -> value instanceof Boolean flag ? flag : null));

        // whatever is left was not part of the known schema, or did not fit it
        experiment.setExtra(remaining);
        return experiment;
    }

    /**
     * Remove {@code field} and convert it. A value the converter rejects (returns
     * {@code null} for) is put back so it ends up in the extra fields.
     */
    private <T> T take(Map<String, Object> remaining, String field, Function<Object, T> converter) {
        Object value = remaining.remove(field);
        if (value == null) {
            return null;
        }
        T converted = converter.apply(value);
        if (converted == null) {
            log.debug("Field {} has unexpected value type {}, kept as extra", field, value.getClass().getSimpleName());
            remaining.put(field, value);
        }
        return converted;
    }

    private ObjectId asObjectId(Object value) {
        if (value instanceof ObjectId objectId) {
            return objectId;
        }
        if (value instanceof String text && ObjectId.isValid(text)) {
            return new ObjectId(text);
        }
        return null;
    }

    private String asString(Object value) {
        return value instanceof String text ? text : null;
    }

    private Instant asInstant(Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        return null;
    }

    private ExperimentStatus asStatus(ObjectId id, Object value) {
        try {
            return ExperimentStatus.valueOf(value.toString());
        } catch (IllegalArgumentException e) {
            log.warn("Experiment {} has unknown status: {}", id, value);
            return null;
        }
    }

    private ExperimentError asError(Object value) {
        Map<String, Object> error = asMap(value);
        if (error == null) {
            return null;
        }
        Map<String, Object> rest = new LinkedHashMap<>(error);
        String message = takeString(rest, ERROR_MESSAGE);
        String traceback = takeString(rest, ERROR_TRACEBACK);
        return ExperimentError.builder()
                .message(message)
                .traceback(traceback)
                .extra(rest)
                .build();
    }

    private String takeString(Map<String, Object> values, String key) {
        if (values.get(key) instanceof String text) {
            values.remove(key);
            return text;
        }
        return null;
    }

    private Integer asInteger(Object value) {
        if (value instanceof Number number && number.longValue() == number.doubleValue()
                && number.longValue() >= Integer.MIN_VALUE && number.longValue() <= Integer.MAX_VALUE) {
            return number.intValue();
        }
        return null;
    }

    private Long asLong(Object value) {
        if (value instanceof Number number && number.longValue() == number.doubleValue()) {
            return number.longValue();
        }
        return null;
    }

    private List<String> asStringList(Object value) {
        if (!(value instanceof Collection<?> items)) {
            return null;
        }
        List<String> strings = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof String text)) {
                return null;
            }
            strings.add(text);
        }
        return strings;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
    }
}
