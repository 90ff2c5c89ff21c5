package org.ensembl.compara.testdb.launcher;

import com.google.inject.AbstractModule;
import org.ensembl.compara.testdb.core.config.ConnectionSettings;
import org.ensembl.compara.testdb.core.config.Platform;
import org.ensembl.compara.testdb.core.config.SubsetConfig;
import org.ensembl.compara.testdb.db.Confirmation;
import org.ensembl.compara.testdb.db.platform.DatabasePlatform;
import org.ensembl.compara.testdb.db.platform.MySqlPlatform;
import org.ensembl.compara.testdb.db.platform.SqlitePlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice wiring for one run. The platform binding is chosen here, everything
 * downstream only sees {@link DatabasePlatform}.
 */
public class SubsetModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(SubsetModule.class);

    private final SubsetConfig config;
    private final Platform platform;
    private final String source;
    private final String destination;
    private final ConnectionSettings connectionSettings;
    private final Confirmation confirmation;

    /**
     * @param connectionSettings server credentials, may be {@code null} for
     *                           file-backed platforms
     */
    public SubsetModule(SubsetConfig config, Platform platform, String source, String destination,
            ConnectionSettings connectionSettings, Confirmation confirmation) {
        this.config = config;
        this.platform = platform;
        this.source = source;
        this.destination = destination;
        this.connectionSettings = connectionSettings;
        this.confirmation = confirmation;
    }

    @Override
    protected void configure() {
        bind(SubsetConfig.class).toInstance(config);
        bind(Confirmation.class).toInstance(confirmation);

        LOG.info("Database platform: {}", platform);
        if (platform == Platform.SQLITE) {
            bind(DatabasePlatform.class).toInstance(new SqlitePlatform(Path.of(source), Path.of(destination)));
        } else {
            bind(DatabasePlatform.class).toInstance(new MySqlPlatform(connectionSettings, source, destination));
        }
    }
}
