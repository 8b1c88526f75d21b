package org.catalogsearch.ingest.common;

import org.catalogsearch.ingest.common.http.HttpResponse;

/** The cluster answered, but not with anything that could be read. */
public class InvalidResponse extends SearchClientException {
    public final transient HttpResponse response;

    public InvalidResponse(String message, HttpResponse response) {
        super(message);
        this.response = response;
    }

    public InvalidResponse(String message, HttpResponse response, Throwable cause) {
        super(message, cause);
        this.response = response;
    }
}
