package org.catalogsearch.ingest.mapping;

/**
 * Raised when a ruleset or code table cannot be loaded or does not describe everything the
 * mapper needs. These are fatal and surface before any record is read.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
