package org.ensembl.compara.testdb.core.config;

import java.util.Objects;

/**
 * Database server credentials. Only meaningful for server-backed platforms;
 * file-backed platforms ignore them.
 *
 * @param host     server host name
 * @param port     server port, 3306 for a default MySQL install
 * @param user     account name
 * @param password account password, never logged
 */
public record ConnectionSettings(String host, int port, String user, String password) {

    public static final int DEFAULT_PORT = 3306;

    public ConnectionSettings {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(user, "user");
        if (port <= 0 || port > 65535)
            throw new IllegalArgumentException("Invalid port: " + port);
    }

    @Override
    public String toString() {
        return user + "@" + host + ":" + port;
    }
}
