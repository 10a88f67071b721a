package de.bsommerfeld.mtgbuilder.core.event;

/**
 * Progress events posted by the ingestion pipeline. Nothing in the pipeline
 * depends on a subscriber being present.
 */
public class IngestEvents {

    /**
     * One result page was normalized and stored.
     *
     * @param query       the query being fetched
     * @param page        1-based page number
     * @param pageCards   cards on this page
     * @param storedTotal rows stored for this query so far
     */
    public record PageStoredEvent(String query, int page, int pageCards, int storedTotal) {
    }

    /** A query finished, successfully ({@code error == null}) or not. */
    public record QueryFinishedEvent(String query, int storedCount, String error) {
        public boolean successful() {
            return error == null;
        }
    }

    /**
     * Bulk download progress. {@code totalBytes} is {@code -1} when the server
     * sent no content length.
     */
    public record DownloadProgressEvent(long bytesRead, long totalBytes) {
        public int percent() {
            return totalBytes > 0 ? (int) (bytesRead * 100 / totalBytes) : -1;
        }
    }

    public record BulkStoreProgressEvent(int stored, int total) {
    }
}
