package de.bsommerfeld.mtgbuilder.core.domain;

/**
 * Base of every failure an ingestion run can report to its caller.
 *
 * <p>
 * Failures never undo rows that were already committed. {@link #getStoredCount()}
 * reports how many rows the failed operation had stored before it stopped, so
 * the caller can decide whether to re-run (upserts make re-runs safe).
 */
public class IngestException extends Exception {

    private final int storedCount;

    public IngestException(String message) {
        this(message, null, 0);
    }

    public IngestException(String message, Throwable cause) {
        this(message, cause, 0);
    }

    public IngestException(String message, Throwable cause, int storedCount) {
        super(message, cause);
        this.storedCount = storedCount;
    }

    /** Rows committed by the failed operation before it stopped. */
    public int getStoredCount() {
        return storedCount;
    }
}
