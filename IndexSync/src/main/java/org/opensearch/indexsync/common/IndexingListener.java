package org.opensearch.indexsync.common;

import org.opensearch.indexsync.schema.PrimaryRecord;

import lombok.extern.slf4j.Slf4j;

/**
 * Out-of-band notifications for per-record index operations. Called from I/O threads once the remote call has
 * settled, well after the triggering save or remove returned.
 */
public interface IndexingListener {
    IndexingListener LOGGING = new LoggingIndexingListener();

    /** @param responseBody body of the search service's reply */
    default void onIndexed(PrimaryRecord record, String responseBody) {}

    /** @param responseBody body of the search service's reply, possibly a not-found body */
    default void onUnindexed(PrimaryRecord record, String responseBody) {}

    void onError(PrimaryRecord record, IndexOperationFailed error);

    @Slf4j
    class LoggingIndexingListener implements IndexingListener {
        @Override
        public void onIndexed(PrimaryRecord record, String responseBody) {
            log.debug("Indexed record {}", record.getId());
        }

        @Override
        public void onUnindexed(PrimaryRecord record, String responseBody) {
            log.debug("Unindexed record {}", record.getId());
        }

        @Override
        public void onError(PrimaryRecord record, IndexOperationFailed error) {
            log.atError().setMessage("Index operation failed for record {}")
                .addArgument(record::getId)
                .setCause(error)
                .log();
        }
    }
}
