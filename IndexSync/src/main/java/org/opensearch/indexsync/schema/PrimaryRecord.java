package org.opensearch.indexsync.schema;

import java.util.Map;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Snapshot of a record in the primary store, as handed over with a lifecycle event or read during a resync.
 * {@code version} and {@code internalFlags} are runtime bookkeeping of the store and never reach the index.
 */
@Value
@Builder(toBuilder = true)
public class PrimaryRecord {
    @NonNull
    String id;
    @Singular
    Map<String, Object> fields;
    @Builder.Default
    RecordState state = RecordState.SAVED;
    long version;
    @Singular
    Set<String> internalFlags;

    public Object get(String fieldName) {
        return fields.get(fieldName);
    }

    public boolean has(String fieldName) {
        return fields.containsKey(fieldName);
    }
}
