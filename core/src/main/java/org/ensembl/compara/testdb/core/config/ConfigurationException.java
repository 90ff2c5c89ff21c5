package org.ensembl.compara.testdb.core.config;

/**
 * Thrown when the configuration file exists but cannot be read or bound.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
