package de.bsommerfeld.mtgbuilder.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Loads and caches SQL statements from classpath resource files under
 * {@code sql/}.
 *
 * <p>
 * Each file is read once and cached for the lifetime of the JVM. Full-line
 * {@code --} comments are removed so the files can document their parameter
 * order. The naming convention is {@code sql/<operation>-<entity>.sql}, e.g.
 * {@code upsert-card.sql}, {@code select-raw-json.sql}.
 *
 * @see SqlDatabaseService
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the SQL statement from {@code sql/<name>.sql} on the classpath.
     *
     * @param name the file stem without path prefix or extension
     * @return the SQL string, ready for {@link java.sql.PreparedStatement} use
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return stripComments(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }

    static String stripComments(String sql) {
        return sql.lines()
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"))
                .trim();
    }
}
