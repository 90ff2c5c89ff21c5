package org.ensembl.compara.testdb.core.config;

import java.util.Locale;

/**
 * The kind of database holding the source and destination schemas.
 */
public enum Platform {

    /** Server-hosted schemas addressed by database name. */
    MYSQL,
    /** Schemas stored in local database files addressed by path. */
    SQLITE;

    /**
     * Parses a platform name case-insensitively.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static Platform of(String name) {
        try {
            return Platform.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown platform '" + name + "', expected mysql or sqlite", e);
        }
    }

    public boolean requiresServer() {
        return this == MYSQL;
    }
}
