package org.catalogsearch.ingest.common.http;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import reactor.core.publisher.Mono;

/**
 * Request plumbing against one cluster: default headers, the host header, and blocking variants
 * of each verb. Subclasses send the finished request.
 */
public abstract class AbstractRestClient {
    private static final String USER_AGENT = "CatalogIngest";
    private static final String JSON_CONTENT_TYPE = "application/json";
    private static final String NDJSON_CONTENT_TYPE = "application/x-ndjson";

    @Getter
    protected final ConnectionContext connectionContext;

    protected AbstractRestClient(ConnectionContext connectionContext) {
        this.connectionContext = connectionContext;
    }

    /** The Host header for the cluster url, leaving out the scheme's default port. */
    public static String getHostHeaderValue(ConnectionContext connectionContext) {
        var uri = connectionContext.getUri();
        int defaultPort = connectionContext.getProtocol() == ConnectionContext.Protocol.HTTPS ? 443 : 80;
        if (uri.getPort() == -1 || uri.getPort() == defaultPort) {
            return uri.getHost();
        }
        return uri.getHost() + ":" + uri.getPort();
    }

    /**
     * Sends a request whose headers have already been prepared.
     *
     * @param path request path relative to the cluster url, without a leading slash
     * @param body the request body, or null
     */
    protected abstract Mono<HttpResponse> execute(String method, String path, String body, Map<String, List<String>> headers);

    public Mono<HttpResponse> asyncRequest(String method, String path, String body) {
        return execute(method, path, body, defaultHeaders(path, body));
    }

    protected Map<String, List<String>> defaultHeaders(String path, String body) {
        Map<String, List<String>> headers = new HashMap<>();
        headers.put("User-Agent", List.of(USER_AGENT));
        headers.put("Host", List.of(getHostHeaderValue(connectionContext)));
        if (body != null) {
            headers.put("Content-Type", List.of(path.endsWith("_bulk") ? NDJSON_CONTENT_TYPE : JSON_CONTENT_TYPE));
        }
        return headers;
    }

    public Mono<HttpResponse> getAsync(String path) {
        return asyncRequest("GET", path, null);
    }

    public HttpResponse get(String path) {
        return getAsync(path).block();
    }

    public Mono<HttpResponse> postAsync(String path, String body) {
        return asyncRequest("POST", path, body);
    }

    public HttpResponse post(String path, String body) {
        return postAsync(path, body).block();
    }

    public Mono<HttpResponse> putAsync(String path, String body) {
        return asyncRequest("PUT", path, body);
    }

    public HttpResponse put(String path, String body) {
        return putAsync(path, body).block();
    }

    public Mono<HttpResponse> deleteAsync(String path) {
        return asyncRequest("DELETE", path, null);
    }

    public HttpResponse delete(String path) {
        return deleteAsync(path).block();
    }
}
