package org.opensearch.indexsync.schema;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A field value pointing at another record. When the store has populated it, {@code populated} holds the
 * referenced record; either way only {@code referencedId} is ever indexed.
 */
@Value
@AllArgsConstructor
public class RecordReference {
    Object referencedId;
    PrimaryRecord populated;

    public static RecordReference to(Object referencedId) {
        return new RecordReference(referencedId, null);
    }

    public static RecordReference populated(PrimaryRecord record) {
        return new RecordReference(record.getId(), record);
    }
}
