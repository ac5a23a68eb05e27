package com.shlawgathon.mlstorage.backend.schema;

/**
 * Field names of the stored experiment document.
 */
public final class ExperimentFields {

    public static final String ID = "id";
    public static final String DATABASE_ID = "_id";
    public static final String PARENT_ID = "parent_id";
    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";
    public static final String TAGS = "tags";
    public static final String START_TIME = "start_time";
    public static final String STOP_TIME = "stop_time";
    public static final String HEARTBEAT = "heartbeat";
    public static final String STATUS = "status";
    public static final String ERROR = "error";
    public static final String EXIT_CODE = "exit_code";
    public static final String STORAGE_DIR = "storage_dir";
    public static final String STORAGE_SIZE = "storage_size";
    public static final String EXC_INFO = "exc_info";
    public static final String WEBUI = "webui";
    public static final String FINGERPRINT = "fingerprint";
    public static final String ARGS = "args";
    public static final String CONFIG = "config";
    public static final String DEFAULT_CONFIG = "default_config";
    public static final String RESULT = "result";
    public static final String DELETED = "deleted";

    // error sub-document
    public static final String ERROR_MESSAGE = "message";
    public static final String ERROR_TRACEBACK = "traceback";

    private ExperimentFields() {
    }
}
