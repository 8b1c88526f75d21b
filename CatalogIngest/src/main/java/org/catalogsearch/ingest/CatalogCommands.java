package org.catalogsearch.ingest;

/** The list of supported commands for the catalog ingest tool */
public enum CatalogCommands {
    /** Parses a record dump and writes the documents to the cluster or standard output */
    INGEST,
    /** Lists the indices on the cluster */
    INDEXES,
    /** Lists aliases and the indices behind them */
    ALIASES,
    /** Shows the cluster name and version */
    PING,
    /** Deletes an index */
    DELETE,
    /** Points the production alias at an index */
    PROMOTE,
    /** Copies one index into another */
    REINDEX;

    public static CatalogCommands fromString(String s) {
        for (var command : values()) {
            if (command.name().equalsIgnoreCase(s)) {
                return command;
            }
        }
        throw new IllegalArgumentException("Unable to find matching command for text:" + s);
    }
}
