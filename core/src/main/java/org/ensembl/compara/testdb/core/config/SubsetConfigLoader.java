package org.ensembl.compara.testdb.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link SubsetConfig} from a TOML file.
 *
 * <p>
 * Unknown keys are rejected so that a misspelt key fails the run instead of
 * silently falling back to a default.
 */
public final class SubsetConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SubsetConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final Path path;

    private SubsetConfigLoader(Path path) {
        this.path = path;
    }

    /**
     * @param path the TOML file, or {@code null} to use defaults only
     */
    public static SubsetConfigLoader from(Path path) {
        return new SubsetConfigLoader(path);
    }

    /**
     * Loads the configuration. A {@code null} or non-existent path yields the
     * defaults.
     *
     * @throws ConfigurationException if the file exists but is not valid
     */
    public SubsetConfig load() {
        if (path == null)
            return new SubsetConfig();
        if (!Files.exists(path)) {
            LOG.warn("Configuration file {} not found, using defaults.", path.toAbsolutePath());
            return new SubsetConfig();
        }

        LOG.info("Loading configuration from: {}", path.toAbsolutePath());
        try {
            return MAPPER.readValue(path.toFile(), SubsetConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration " + path + ": " + e.getMessage(), e);
        }
    }
}
