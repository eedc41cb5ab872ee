package org.opensearch.indexsync.pipeline.source;

import java.util.Iterator;
import java.util.function.Supplier;

import org.opensearch.indexsync.schema.PrimaryRecord;

import reactor.core.publisher.Flux;

/**
 * Port for enumerating the records of a collection in the primary store.
 */
public interface RecordSource {

    /**
     * Stream every record currently stored in the collection. Returns a cold, single-pass Flux: subscription opens
     * the cursor, and an error signal means the enumeration itself broke.
     */
    Flux<PrimaryRecord> readRecords(String collectionName);

    /**
     * Adapts a store cursor. The cursor is opened on subscription and closed when the stream terminates or is
     * cancelled, if it is {@link AutoCloseable}.
     */
    static Flux<PrimaryRecord> fromCursor(Supplier<? extends Iterator<PrimaryRecord>> cursorFactory) {
        return Flux.<PrimaryRecord, Iterator<PrimaryRecord>>using(
            cursorFactory::get,
            cursor -> {
                Iterable<PrimaryRecord> singlePass = () -> cursor;
                return Flux.fromIterable(singlePass);
            },
            cursor -> {
                if (cursor instanceof AutoCloseable) {
                    try {
                        ((AutoCloseable) cursor).close();
                    } catch (Exception e) {
                        throw new IllegalStateException("Unable to close record cursor", e);
                    }
                }
            }
        );
    }
}
