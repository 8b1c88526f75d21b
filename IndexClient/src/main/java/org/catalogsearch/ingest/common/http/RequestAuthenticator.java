package org.catalogsearch.ingest.common.http;

import java.util.List;
import java.util.Map;

/**
 * Adds credentials to the headers of an outgoing request.
 */
@FunctionalInterface
public interface RequestAuthenticator {
    RequestAuthenticator NONE = headers -> headers;

    /** Returns the headers to send; {@code headers} itself is left unchanged. */
    Map<String, List<String>> authenticate(Map<String, List<String>> headers);
}
