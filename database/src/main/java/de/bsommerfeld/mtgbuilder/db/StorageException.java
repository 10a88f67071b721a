package de.bsommerfeld.mtgbuilder.db;

import de.bsommerfeld.mtgbuilder.core.domain.IngestException;

/**
 * A storage operation failed. The failing transaction has already been
 * rolled back; rows committed by earlier transactions of the same operation
 * are reported through {@link #getStoredCount()}.
 */
public class StorageException extends IngestException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message, Throwable cause, int storedCount) {
        super(message, cause, storedCount);
    }
}
