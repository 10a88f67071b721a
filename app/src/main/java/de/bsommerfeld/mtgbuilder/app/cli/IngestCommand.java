package de.bsommerfeld.mtgbuilder.app.cli;

import de.bsommerfeld.mtgbuilder.core.domain.IngestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Base of all sub-commands. Output goes through the command line's writers so
 * callers can capture it; an {@link IngestException} ends the command with exit
 * code {@code 1}.
 */
abstract class IngestCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(IngestCommand.class);

    @Spec
    CommandSpec spec;

    @Override
    public final Integer call() {
        try {
            return execute();
        } catch (IngestException e) {
            LOG.error("{} failed: {}", spec.name(), e.getMessage());
            LOG.debug("Failure details", e);
            err().printf("Error: %s%n", e.getMessage());
            if (e.getStoredCount() > 0) {
                err().printf("%d cards were stored before the failure.%n", e.getStoredCount());
            }
            return 1;
        }
    }

    protected abstract int execute() throws IngestException;

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
