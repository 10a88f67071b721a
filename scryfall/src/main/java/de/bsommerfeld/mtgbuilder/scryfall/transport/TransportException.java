package de.bsommerfeld.mtgbuilder.scryfall.transport;

import de.bsommerfeld.mtgbuilder.core.domain.IngestException;

/**
 * A request did not produce a usable response: non-2xx status, connection
 * or timeout failure, malformed body, interrupted wait, or a pagination
 * cursor that points back to an earlier page.
 */
public class TransportException extends IngestException {

    /** Marker for failures that did not come with an HTTP status. */
    public static final int NO_STATUS = -1;

    private final int statusCode;

    public TransportException(String message) {
        this(message, NO_STATUS, null);
    }

    public TransportException(String message, Throwable cause) {
        this(message, NO_STATUS, cause);
    }

    public TransportException(String message, int statusCode, Throwable cause) {
        this(message, statusCode, cause, 0);
    }

    private TransportException(String message, int statusCode, Throwable cause, int storedCount) {
        super(message, cause, storedCount);
        this.statusCode = statusCode;
    }

    /**
     * Returns a copy that additionally reports how many rows the aborted
     * operation had already committed.
     */
    public TransportException withStoredCount(int storedCount) {
        TransportException copy = new TransportException(getMessage(), statusCode, getCause(), storedCount);
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    /** HTTP status of the failed response, or {@link #NO_STATUS}. */
    public int getStatusCode() {
        return statusCode;
    }
}
