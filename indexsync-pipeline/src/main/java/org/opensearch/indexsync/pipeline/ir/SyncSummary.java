package org.opensearch.indexsync.pipeline.ir;

/**
 * Progress of a resync job; the final one is delivered when the job ends.
 *
 * @param aborted whether an abort stopped the record stream before it was fully read
 * @param cause why the job failed, null unless the record enumeration broke
 */
public record SyncSummary(
    String collectionName,
    SyncState state,
    long scanned,
    long indexed,
    long failed,
    boolean aborted,
    Throwable cause
) {
    public long attempted() {
        return indexed + failed;
    }
}
