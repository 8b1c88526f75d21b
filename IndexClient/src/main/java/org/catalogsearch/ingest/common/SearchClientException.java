package org.catalogsearch.ingest.common;

public class SearchClientException extends RuntimeException {
    public SearchClientException(String message) {
        super(message);
    }

    public SearchClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
