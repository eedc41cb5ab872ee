package org.opensearch.indexsync.pipeline.source;

import org.opensearch.indexsync.schema.PrimaryRecord;
import org.opensearch.indexsync.schema.SchemaDescriptor;

/**
 * Implemented by whatever keeps the index in step; invoked by the primary store right after a write has committed.
 * Implementations return promptly and never throw back into the store.
 */
public interface RecordLifecycleListener {

    void onRecordSaved(PrimaryRecord record, SchemaDescriptor schema);

    void onRecordRemoved(PrimaryRecord record, SchemaDescriptor schema);
}
