package com.smarttest.core.persistence;

/**
 * Thrown when a run row was changed by another writer after it was read for an update.
 * Nothing is written; the caller may re-read the run and try again.
 */
public class StaleRunException extends PersistenceException {

    private final String runId;
    private final long expectedVersion;

    public StaleRunException(String runId, long expectedVersion) {
        super("Run " + runId + " was modified concurrently (expected version " + expectedVersion + ")", null);
        this.runId = runId;
        this.expectedVersion = expectedVersion;
    }

    public String getRunId() { return runId; }
    public long getExpectedVersion() { return expectedVersion; }
}
