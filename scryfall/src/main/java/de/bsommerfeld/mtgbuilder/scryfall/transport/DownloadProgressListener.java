package de.bsommerfeld.mtgbuilder.scryfall.transport;

/**
 * Callback for tracking download progress.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    DownloadProgressListener NONE = (bytesRead, totalBytes) -> {
    };

    /**
     * Called after every chunk read from the response body.
     *
     * @param bytesRead  bytes transferred so far
     * @param totalBytes total expected size, or -1 if unknown
     */
    void onProgress(long bytesRead, long totalBytes);
}
