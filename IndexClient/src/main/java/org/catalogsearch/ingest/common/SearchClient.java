package org.catalogsearch.ingest.common;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import org.catalogsearch.ingest.common.http.AbstractRestClient;
import org.catalogsearch.ingest.common.http.ConnectionContext;
import org.catalogsearch.ingest.common.http.HttpResponse;
import org.catalogsearch.ingest.common.http.ReactorNettyRestClient;
import org.catalogsearch.ingest.common.model.AliasInfo;
import org.catalogsearch.ingest.common.model.ClusterInfo;
import org.catalogsearch.ingest.common.model.IndexInfo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Index administration and bulk writes against an Elasticsearch/OpenSearch cluster.
 *
 * <p>Read probes are retried briefly; bulk requests retry only the documents that failed.
 * Administrative writes are never retried here.
 */
@Slf4j
public class SearchClient {
    protected static final ObjectMapper objectMapper = new ObjectMapper();

    private static final int DEFAULT_MAX_RETRY_ATTEMPTS = 3;
    private static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(1);
    private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(10);
    public static final Retry CHECK_IF_ITEM_EXISTS_RETRY_STRATEGY =
        Retry.backoff(DEFAULT_MAX_RETRY_ATTEMPTS, DEFAULT_BACKOFF)
            .maxBackoff(DEFAULT_MAX_BACKOFF)
            .filter(throwable -> !(throwable instanceof InvalidResponse));

    private static final int BULK_MAX_RETRY_ATTEMPTS = 15;
    private static final Duration BULK_BACKOFF = Duration.ofSeconds(2);
    private static final Duration BULK_MAX_BACKOFF = Duration.ofSeconds(60);
    /** Retries for up to 10 minutes */
    private static final Retry BULK_RETRY_STRATEGY = Retry.backoff(BULK_MAX_RETRY_ATTEMPTS, BULK_BACKOFF)
        .maxBackoff(BULK_MAX_BACKOFF);
    public static final int BULK_TRUNCATED_RESPONSE_MAX_LENGTH = 1500;

    private static final Pattern FAILED_OPERATIONS_PATTERN = Pattern.compile("\"errors\"\\s*:\\s*true");

    @Getter
    protected final AbstractRestClient client;
    protected final FailedRequestsLogger failedRequestsLogger;

    public SearchClient(ConnectionContext connectionContext, int maxConnections) {
        this(new ReactorNettyRestClient(connectionContext, maxConnections), new FailedRequestsLogger());
    }

    public SearchClient(AbstractRestClient client, FailedRequestsLogger failedRequestsLogger) {
        this.client = client;
        this.failedRequestsLogger = failedRequestsLogger;
    }

    public ClusterInfo ping() {
        var response = client.getAsync("")
            .flatMap(resp -> expectOk(resp, "Could not reach cluster"))
            .retryWhen(checkRetryStrategy())
            .onErrorMap(Exceptions::isRetryExhausted, Throwable::getCause)
            .block();
        var root = readTree(response);
        return new ClusterInfo(
            root.path("name").asText(),
            root.path("cluster_name").asText(),
            root.path("version").path("number").asText(),
            root.path("version").path("lucene_version").asText()
        );
    }

    public List<IndexInfo> listIndices() {
        var response = client.getAsync("_cat/indices?format=json")
            .flatMap(resp -> expectOk(resp, "Could not list indices"))
            .retryWhen(checkRetryStrategy())
            .onErrorMap(Exceptions::isRetryExhausted, Throwable::getCause)
            .block();
        return readList(response, new TypeReference<List<IndexInfo>>() {});
    }

    public List<AliasInfo> listAliases() {
        var response = client.getAsync("_cat/aliases?format=json")
            .flatMap(resp -> expectOk(resp, "Could not list aliases"))
            .retryWhen(checkRetryStrategy())
            .onErrorMap(Exceptions::isRetryExhausted, Throwable::getCause)
            .block();
        return readList(response, new TypeReference<List<AliasInfo>>() {});
    }

    /** Returns true if this index already exists */
    public boolean hasIndex(String indexName) {
        var response = client.getAsync(indexName)
            .flatMap(resp -> {
                if (resp.statusCode == HttpURLConnection.HTTP_NOT_FOUND || resp.statusCode == HttpURLConnection.HTTP_OK) {
                    return Mono.just(resp);
                }
                return Mono.<HttpResponse>error(new OperationFailed("Could not check for index " + indexName, resp));
            })
            .doOnError(e -> log.error(e.getMessage()))
            .retryWhen(checkRetryStrategy())
            .onErrorMap(Exceptions::isRetryExhausted, Throwable::getCause)
            .block();
        log.atDebug().setMessage("Index {} lookup answered {}").addArgument(indexName).addArgument(response.statusCode).log();
        return response.statusCode == HttpURLConnection.HTTP_OK;
    }

    /**
     * Creates the index with the given settings and mappings.  Returns false, without changing
     * anything, if the index already exists.
     */
    public boolean createIndex(String indexName, ObjectNode settings) {
        if (hasIndex(indexName)) {
            log.atDebug().setMessage("Index {} already exists, not attempting to create.").addArgument(indexName).log();
            return false;
        }
        var body = settings == null ? "{}" : settings.toString();
        var response = client.put(indexName, body);
        if (response.statusCode == HttpURLConnection.HTTP_BAD_REQUEST) {
            throw new InvalidResponse("Create index failed for " + indexName + "\r\n" + response.body, response);
        }
        if (response.statusCode != HttpURLConnection.HTTP_OK) {
            throw new OperationFailed("Could not create index " + indexName, response);
        }
        log.atInfo().setMessage("Created index {}").addArgument(indexName).log();
        return true;
    }

    public void deleteIndex(String indexName) {
        var response = client.delete(indexName);
        if (response.statusCode == HttpURLConnection.HTTP_NOT_FOUND) {
            throw new IndexNotFoundException(indexName);
        }
        if (response.statusCode != HttpURLConnection.HTTP_OK) {
            throw new OperationFailed("Could not delete index " + indexName, response);
        }
    }

    /** The indices the alias currently points at; empty when the alias does not exist. */
    public Set<String> aliasTargets(String alias) {
        var response = client.getAsync("_alias/" + alias)
            .flatMap(resp -> {
                if (resp.statusCode == HttpURLConnection.HTTP_NOT_FOUND || resp.statusCode == HttpURLConnection.HTTP_OK) {
                    return Mono.just(resp);
                }
                return Mono.<HttpResponse>error(new OperationFailed("Could not read alias " + alias, resp));
            })
            .retryWhen(checkRetryStrategy())
            .onErrorMap(Exceptions::isRetryExhausted, Throwable::getCause)
            .block();
        if (response.statusCode == HttpURLConnection.HTTP_NOT_FOUND) {
            return Set.of();
        }
        var targets = new LinkedHashSet<String>();
        readTree(response).fieldNames().forEachRemaining(targets::add);
        return targets;
    }

    /**
     * Points {@code alias} at {@code indexName} only, in one {@code _aliases} request whose
     * actions the cluster applies atomically.
     */
    public void swapAlias(String alias, Collection<String> previousIndices, String indexName) {
        var actions = objectMapper.createArrayNode();
        for (var previous : previousIndices) {
            if (previous.equals(indexName)) {
                continue;
            }
            actions.addObject().putObject("remove").put("index", previous).put("alias", alias);
        }
        actions.addObject().putObject("add").put("index", indexName).put("alias", alias);
        var body = objectMapper.createObjectNode();
        body.set("actions", actions);

        var response = client.post("_aliases", body.toString());
        if (response.statusCode != HttpURLConnection.HTTP_OK) {
            throw new OperationFailed("Could not point alias " + alias + " at " + indexName, response);
        }
        var acknowledged = readTree(response).path("acknowledged");
        if (!acknowledged.isMissingNode() && !acknowledged.asBoolean()) {
            throw new OperationFailed("Alias update for " + alias + " was not acknowledged", response);
        }
    }

    /**
     * Copies every document of {@code sourceIndex} into {@code destinationIndex} and waits for the
     * copy to finish.
     *
     * @return The number of documents the cluster reported as copied
     */
    public long reindex(String sourceIndex, String destinationIndex) {
        var body = objectMapper.createObjectNode();
        body.putObject("source").put("index", sourceIndex);
        body.putObject("dest").put("index", destinationIndex);

        var response = client.post("_reindex?wait_for_completion=true", body.toString());
        if (response.statusCode == HttpURLConnection.HTTP_NOT_FOUND) {
            throw new IndexNotFoundException(sourceIndex);
        }
        if (response.statusCode != HttpURLConnection.HTTP_OK) {
            throw new OperationFailed("Could not reindex " + sourceIndex + " into " + destinationIndex, response);
        }
        var result = readTree(response);
        var failures = result.path("failures");
        if (failures.isArray() && failures.size() > 0) {
            throw new OperationFailed(
                "Reindex of " + sourceIndex + " into " + destinationIndex + " reported " + failures.size() + " failures",
                response
            );
        }
        return result.path("total").asLong();
    }

    public HttpResponse refresh(String indexName) {
        return client.post(indexName + "/_refresh", null);
    }

    protected Retry checkRetryStrategy() {
        return CHECK_IF_ITEM_EXISTS_RETRY_STRATEGY;
    }

    protected Retry getBulkRetryStrategy() {
        return BULK_RETRY_STRATEGY;
    }

    private static String truncateMessageIfNeeded(String input, int maxCharacters) {
        if (input == null || input.length() <= maxCharacters) {
            return input;
        }
        int partLength = maxCharacters / 2;
        String head = input.substring(0, partLength);
        String tail = input.substring(input.length() - partLength);
        return head + "... [truncated] ..." + tail;
    }

    /**
     * Writes the documents with the {@code _bulk} API.  After a partial failure only the
     * documents that have not yet been written are resent.  If documents still remain when the
     * retries run out, the error is a {@link BulkRequestFailed} carrying how many were written.
     */
    public Mono<BulkResponse> sendBulkRequest(String indexName, List<BulkDocSection> docs) {
        final var attemptCounter = new AtomicInteger(0);
        final var remaining = new ArrayList<>(docs);
        return Mono.defer(() -> {
            var pending = List.copyOf(remaining);
            log.atTrace().setMessage("Creating bulk body with {} documents").addArgument(pending::size).log();
            var body = BulkDocSection.convertToBulkRequestBody(pending);
            return client.postAsync("_bulk", body)
                .flatMap(response -> {
                    var resp = new BulkResponse(response.statusCode, response.statusText, response.headers, response.body);
                    if (!resp.hasBadStatusCode() && !resp.hasFailedOperations()) {
                        remaining.clear();
                        return Mono.just(resp);
                    }
                    log.atDebug().setMessage("Response has some errors...: {}").addArgument(response.body).log();
                    var successfulPositions = resp.getSuccessfulPositions();
                    var succeeded = new HashSet<Integer>(successfulPositions);
                    remaining.clear();
                    for (int i = 0; i < pending.size(); i++) {
                        if (!succeeded.contains(i)) {
                            remaining.add(pending.get(i));
                        }
                    }
                    if (remaining.isEmpty()) {
                        return Mono.just(resp);
                    }
                    log.atWarn()
                        .setMessage("After bulk request attempt {} on index '{}', {} more documents have succeeded, {} remain. The error response message was: {}")
                        .addArgument(attemptCounter.incrementAndGet())
                        .addArgument(indexName)
                        .addArgument(successfulPositions::size)
                        .addArgument(remaining::size)
                        .addArgument(truncateMessageIfNeeded(response.body, BULK_TRUNCATED_RESPONSE_MAX_LENGTH))
                        .log();
                    return Mono.error(new OperationFailed(resp.getFailureMessage(), resp));
                });
        })
        .retryWhen(getBulkRetryStrategy())
        .doOnError(error -> {
            if (!remaining.isEmpty()) {
                failedRequestsLogger.logBulkFailure(indexName, List.copyOf(remaining), error);
            }
        })
        .onErrorMap(error -> new BulkRequestFailed(
            indexName,
            docs.size() - remaining.size(),
            remaining.size(),
            Exceptions.isRetryExhausted(error) && error.getCause() != null ? error.getCause() : error
        ));
    }

    private static Mono<HttpResponse> expectOk(HttpResponse resp, String failureMessage) {
        if (resp.statusCode == HttpURLConnection.HTTP_OK) {
            return Mono.just(resp);
        }
        return Mono.error(new OperationFailed(failureMessage, resp));
    }

    private static JsonNode readTree(HttpResponse response) {
        try {
            return objectMapper.readTree(response.body == null ? "{}" : response.body);
        } catch (IOException e) {
            throw new InvalidResponse("Unable to parse response body: " + e.getMessage(), response, e);
        }
    }

    private static <T> List<T> readList(HttpResponse response, TypeReference<List<T>> type) {
        try {
            return objectMapper.readValue(response.body == null ? "[]" : response.body, type);
        } catch (IOException e) {
            throw new InvalidResponse("Unable to parse response body: " + e.getMessage(), response, e);
        }
    }

    public static class BulkResponse extends HttpResponse {
        public BulkResponse(int statusCode, String statusText, Map<String, String> headers, String body) {
            super(statusCode, statusText, headers, body);
        }

        public boolean hasBadStatusCode() {
            return !(statusCode == HttpURLConnection.HTTP_OK || statusCode == HttpURLConnection.HTTP_CREATED);
        }

        public boolean hasFailedOperations() {
            // Checks the top-level "errors" flag without parsing the whole response
            return body != null && FAILED_OPERATIONS_PATTERN.matcher(body).find();
        }

        public List<Integer> getSuccessfulPositions() {
            if (body == null) {
                return List.of();
            }
            try {
                return BulkResponseParser.findSuccessfulPositions(body);
            } catch (IOException ioe) {
                log.warn("Unable to process bulk response for successes", ioe);
                return List.of();
            }
        }

        public String getFailureMessage() {
            if (hasBadStatusCode()) {
                return "Bulk request failed.  Status code: " + statusCode + ", Response body: " + body;
            }
            return "Bulk request succeeded, but some operations failed.  Response body: " + body;
        }
    }

    public static class OperationFailed extends SearchClientException {
        public final transient HttpResponse response;

        public OperationFailed(String message, HttpResponse response) {
            super(message + "\nBody:\n" + response);
            this.response = response;
        }
    }

    /** A bulk request gave up with documents still unwritten. */
    public static class BulkRequestFailed extends SearchClientException {
        @Getter
        private final int confirmedDocs;
        @Getter
        private final int failedDocs;

        public BulkRequestFailed(String indexName, int confirmedDocs, int failedDocs, Throwable cause) {
            super("Bulk request to " + indexName + " failed with " + failedDocs + " documents unwritten", cause);
            this.confirmedDocs = confirmedDocs;
            this.failedDocs = failedDocs;
        }
    }
}
