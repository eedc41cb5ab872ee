package org.opensearch.indexsync.schema;

public enum RecordState {
    UNSAVED,
    SAVED,
    REMOVED
}
