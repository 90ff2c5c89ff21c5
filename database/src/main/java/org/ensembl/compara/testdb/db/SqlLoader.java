package org.ensembl.compara.testdb.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Raw access to the statement templates shipped in {@code sql/}. One file
 * holds one statement, named after the table it fills or reads, e.g.
 * {@code copy-homology-member.sql}.
 *
 * <p>
 * Text comes back unrendered, placeholders included. Go through
 * {@link SqlContext} to get executable SQL.
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> TEMPLATES = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * @param name template name, e.g. {@code "copy-dnafrag"}
     * @throws IllegalStateException if {@code sql/<name>.sql} is not on the classpath
     */
    public static String load(String name) {
        return TEMPLATES.computeIfAbsent(name, SqlLoader::read);
    }

    private static String read(String name) {
        String resource = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalStateException("No SQL template " + resource + " on the classpath");
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read SQL template " + resource, e);
        }
    }
}
