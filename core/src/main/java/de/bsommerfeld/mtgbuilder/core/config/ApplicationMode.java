package de.bsommerfeld.mtgbuilder.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Selects the storage binding: the SQLite database in {@link #PROD}, an
 * in-memory store in {@link #TEST}.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Reads the system property {@code app.mode}, then the environment
     * variable {@code APP_MODE}.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty("app.mode");
        return parse(mode == null || mode.isBlank() ? System.getenv("APP_MODE") : mode);
    }

    /** Case-insensitive; blank or unknown values fall back to PROD. */
    static ApplicationMode parse(String mode) {
        if (mode == null || mode.isBlank())
            return PROD;
        try {
            return valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown Application Mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }
}
