package org.catalogsearch.ingest.common;

import lombok.Getter;

public class IndexNotFoundException extends SearchClientException {
    @Getter
    private final String indexName;

    public IndexNotFoundException(String indexName) {
        super("Index '" + indexName + "' does not exist");
        this.indexName = indexName;
    }
}
