package de.bsommerfeld.mtgbuilder.app.cli;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.mtgbuilder.core.event.IngestEvents;

import java.io.PrintWriter;

/**
 * Writes pipeline progress to the terminal. Registered on the event bus for
 * the duration of one command.
 */
final class ProgressPrinter {

    private final PrintWriter out;

    ProgressPrinter(PrintWriter out) {
        this.out = out;
    }

    @Subscribe
    public void onPageStored(IngestEvents.PageStoredEvent event) {
        out.printf("[%s] page %d: %d cards (%d total)%n",
                event.query(), event.page(), event.pageCards(), event.storedTotal());
        out.flush();
    }

    @Subscribe
    public void onQueryFinished(IngestEvents.QueryFinishedEvent event) {
        if (event.successful()) {
            out.printf("[%s] done, %d cards stored%n", event.query(), event.storedCount());
        } else {
            out.printf("[%s] failed after %d cards: %s%n", event.query(), event.storedCount(), event.error());
        }
        out.flush();
    }

    @Subscribe
    public void onDownloadProgress(IngestEvents.DownloadProgressEvent event) {
        if (event.percent() >= 0) {
            out.printf("Downloading... %d%% (%d bytes)%n", event.percent(), event.bytesRead());
        } else {
            out.printf("Downloading... %d bytes%n", event.bytesRead());
        }
        out.flush();
    }

    @Subscribe
    public void onBulkStoreProgress(IngestEvents.BulkStoreProgressEvent event) {
        out.printf("Storing... %d/%d%n", event.stored(), event.total());
        out.flush();
    }
}
