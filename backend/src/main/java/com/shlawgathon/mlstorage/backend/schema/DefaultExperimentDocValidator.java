package com.shlawgathon.mlstorage.backend.schema;

import com.shlawgathon.mlstorage.backend.exception.ExperimentValidationException;
import com.shlawgathon.mlstorage.backend.exception.InvalidExperimentIdException;
import com.shlawgathon.mlstorage.backend.model.ExperimentError;
import com.shlawgathon.mlstorage.backend.model.ExperimentStatus;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.shlawgathon.mlstorage.backend.schema.ExperimentFields.*;

/**
 * Default rule set for experiment documents.
 *
 * Known fields are type-checked and normalized (ids to {@link ObjectId},
 * timestamps to UTC {@link Date}, status to its name). Unknown fields are kept as-is.
 * Update payloads and query filters may also carry dotted paths; only filters
 * may carry operator expressions such as {@code {"$in": [...]}}.
 */
@Component
public class DefaultExperimentDocValidator implements ExperimentDocValidator {

    private static final Set<String> LIST_OPERATORS = Set.of("$in", "$nin", "$all");
    private static final Set<String> PASS_THROUGH_OPERATORS = Set.of("$regex", "$options", "$size", "$type");

    @Override
    public Map<String, Object> validateDocument(Map<String, Object> candidate, ValidationMode mode) {
        Map<String, Object> shaped = new LinkedHashMap<>();
        if (candidate == null) {
            return shaped;
        }
        for (Map.Entry<String, Object> entry : candidate.entrySet()) {
            String field = entry.getKey();
            Object value = entry.getValue();
            checkFieldName(field, mode);

            if (isOperatorExpression(value)) {
                if (mode != ValidationMode.FILTER) {
                    throw new ExperimentValidationException(field,
                            "operator expressions are only allowed in query filters");
                }
                shaped.put(field, field.indexOf('.') >= 0 ? value : validateOperators(field, (Map<?, ?>) value));
            } else if (field.indexOf('.') >= 0) {
                // nested path, e.g. "result.loss"
                shaped.put(field, value);
            } else {
                shaped.put(field, validateValue(field, value, mode));
            }
        }
        return shaped;
    }

    @Override
    public ObjectId validateId(Object id) {
        if (id == null) {
            throw new InvalidExperimentIdException(null);
        }
        return toObjectId(ID, id);
    }

    private void checkFieldName(String field, ValidationMode mode) {
        if (field == null || field.isEmpty()) {
            throw new ExperimentValidationException("field names must not be empty");
        }
        if (field.startsWith("$")) {
            throw new ExperimentValidationException(field, "field names must not start with '$'");
        }
        if (!mode.allowsDottedPaths() && field.indexOf('.') >= 0) {
            throw new ExperimentValidationException(field, "dotted field names are not allowed in a new document");
        }
    }

    private boolean isOperatorExpression(Object value) {
        if (!(value instanceof Map<?, ?> map) || map.isEmpty()) {
            return false;
        }
        for (Object key : map.keySet()) {
            if (!(key instanceof String name) || !name.startsWith("$")) {
                return false;
            }
        }
        return true;
    }

    private Map<String, Object> validateOperators(String field, Map<?, ?> expression) {
        Map<String, Object> shaped = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : expression.entrySet()) {
            String operator = (String) entry.getKey();
            Object operand = entry.getValue();

            if (LIST_OPERATORS.contains(operator)) {
                if (!(operand instanceof Collection<?> values)) {
                    throw new ExperimentValidationException(field, operator + " expects a list");
                }
                List<Object> items = new ArrayList<>(values.size());
                for (Object item : values) {
                    items.add(validateValue(field, item, ValidationMode.FILTER));
                }
                shaped.put(operator, items);
            } else if ("$exists".equals(operator)) {
                if (!(operand instanceof Boolean)) {
                    throw new ExperimentValidationException(field, "$exists expects a boolean");
                }
                shaped.put(operator, operand);
            } else if ("$not".equals(operator) && isOperatorExpression(operand)) {
                shaped.put(operator, validateOperators(field, (Map<?, ?>) operand));
            } else if (PASS_THROUGH_OPERATORS.contains(operator) || "$not".equals(operator)) {
                shaped.put(operator, operand);
            } else {
                shaped.put(operator, validateValue(field, operand, ValidationMode.FILTER));
            }
        }
        return shaped;
    }

    private Object validateValue(String field, Object value, ValidationMode mode) {
        if (value == null) {
            return null;
        }
        switch (field) {
            case ID:
            case DATABASE_ID:
            case PARENT_ID:
                return toObjectId(field, value);
            case NAME:
                String name = requireString(field, value);
                if (mode == ValidationMode.DOCUMENT && name.isBlank()) {
                    throw new ExperimentValidationException(field, "must not be blank");
                }
                return name;
            case DESCRIPTION:
            case STORAGE_DIR:
            case FINGERPRINT:
                return requireString(field, value);
            case TAGS:
                return toTags(value, mode);
            case START_TIME:
            case STOP_TIME:
            case HEARTBEAT:
                return toDate(field, value);
            case STATUS:
                return toStatus(value);
            case ERROR:
                return toError(value);
            case EXIT_CODE:
                long code = requireIntegral(field, value);
                if (code < Integer.MIN_VALUE || code > Integer.MAX_VALUE) {
                    throw new ExperimentValidationException(field, "out of range: " + code);
                }
                return (int) code;
            case STORAGE_SIZE:
                long size = requireIntegral(field, value);
                if (size < 0) {
                    throw new ExperimentValidationException(field, "must not be negative");
                }
                return size;
            case EXC_INFO:
            case WEBUI:
            case CONFIG:
            case DEFAULT_CONFIG:
            case RESULT:
                return requireMap(field, value);
            case DELETED:
                if (!(value instanceof Boolean)) {
                    throw new ExperimentValidationException(field, "must be a boolean");
                }
                return value;
            default:
                return value;
        }
    }

    private ObjectId toObjectId(String field, Object value) {
        if (value instanceof ObjectId objectId) {
            return objectId;
        }
        if (value instanceof String text && ObjectId.isValid(text)) {
            return new ObjectId(text);
        }
        throw new InvalidExperimentIdException(field, value);
    }

    private String requireString(String field, Object value) {
        if (!(value instanceof String text)) {
            throw new ExperimentValidationException(field, "must be a string");
        }
        return text;
    }

    private Object toTags(Object value, ValidationMode mode) {
        if (mode == ValidationMode.FILTER && value instanceof String) {
            // matches documents whose tag list contains the value
            return value;
        }
        if (!(value instanceof Collection<?> items)) {
            throw new ExperimentValidationException(TAGS, "must be a list of strings");
        }
        List<String> tags = new ArrayList<>(items.size());
        for (Object item : items) {
            tags.add(requireString(TAGS, item));
        }
        return tags;
    }

    private Date toDate(String field, Object value) {
        Instant instant;
        if (value instanceof Date date) {
            instant = date.toInstant();
        } else if (value instanceof Instant i) {
            instant = i;
        } else if (value instanceof OffsetDateTime odt) {
            instant = odt.toInstant();
        } else if (value instanceof ZonedDateTime zdt) {
            instant = zdt.toInstant();
        } else if (value instanceof String text) {
            instant = parseTimestamp(field, text);
        } else {
            throw new ExperimentValidationException(field, "must be a timestamp");
        }
        return Date.from(instant.truncatedTo(ChronoUnit.MILLIS));
    }

    private Instant parseTimestamp(String field, String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            // no offset given, read as UTC
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                throw new ExperimentValidationException(field, "not an ISO-8601 timestamp: " + text);
            }
        }
    }

    private String toStatus(Object value) {
        if (value instanceof ExperimentStatus status) {
            return status.name();
        }
        if (value instanceof String text) {
            try {
                return ExperimentStatus.valueOf(text).name();
            } catch (IllegalArgumentException e) {
                throw new ExperimentValidationException(STATUS, "unknown status: " + text);
            }
        }
        throw new ExperimentValidationException(STATUS, "must be a string");
    }

    private Map<String, Object> toError(Object value) {
        if (value instanceof ExperimentError error) {
            Map<String, Object> shaped = new LinkedHashMap<>();
            if (error.getExtra() != null) {
                shaped.putAll(error.getExtra());
            }
            shaped.put(ERROR_MESSAGE, error.getMessage());
            if (error.getTraceback() != null) {
                shaped.put(ERROR_TRACEBACK, error.getTraceback());
            }
            return shaped;
        }
        Map<String, Object> shaped = requireMap(ERROR, value);
        for (String key : List.of(ERROR_MESSAGE, ERROR_TRACEBACK)) {
            Object part = shaped.get(key);
            if (part != null && !(part instanceof String)) {
                throw new ExperimentValidationException(ERROR + "." + key, "must be a string");
            }
        }
        return shaped;
    }

    private long requireIntegral(String field, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw new ExperimentValidationException(field, "must be an integer");
    }

    private Map<String, Object> requireMap(String field, Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new ExperimentValidationException(field, "must be a mapping");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new ExperimentValidationException(field, "keys must be strings");
            }
            copy.put(key, entry.getValue());
        }
        return copy;
    }
}
