package org.catalogsearch.ingest.common;

import java.util.List;
import java.util.stream.Collectors;

import org.catalogsearch.ingest.common.SearchClient.OperationFailed;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the records of bulk requests that could not be written. The application log only names
 * their identifiers; the full request body goes to the {@value #FAILED_REQUESTS_LOGGER} logger,
 * from which the records can be resubmitted by hand.
 */
@Slf4j
public class FailedRequestsLogger {
    public static final String FAILED_REQUESTS_LOGGER = "FailedRequestsLogger";

    static final String INDEX_NAME = "indexName";
    static final String RECORD_IDS = "recordIds";
    static final String ERROR = "error";
    static final String REQUEST_BODY = "requestBody";
    static final String RESPONSE_BODY = "responseBody";

    private static final int MAX_LOGGED_IDS = 20;

    private final Logger failedRequests;

    public FailedRequestsLogger() {
        this(LoggerFactory.getLogger(FAILED_REQUESTS_LOGGER));
    }

    FailedRequestsLogger(Logger failedRequests) {
        this.failedRequests = failedRequests;
    }

    public void logBulkFailure(String indexName, List<BulkDocSection> unwritten, Throwable error) {
        var cause = rootCause(error);
        var responseBody = cause instanceof OperationFailed ? ((OperationFailed) cause).response.body : null;

        log.atError()
            .setCause(error)
            .setMessage("{} records could not be written to {}, first ids: {}. The request is in the {} log")
            .addArgument(unwritten::size)
            .addArgument(indexName)
            .addArgument(() -> recordIds(unwritten, MAX_LOGGED_IDS))
            .addArgument(FAILED_REQUESTS_LOGGER)
            .log();

        failedRequests.atInfo()
            .addKeyValue(INDEX_NAME, indexName)
            .addKeyValue(RECORD_IDS, recordIds(unwritten, unwritten.size()))
            .addKeyValue(ERROR, cause == null ? null : cause.getMessage())
            .addKeyValue(REQUEST_BODY, BulkDocSection.convertToBulkRequestBody(unwritten))
            .addKeyValue(RESPONSE_BODY, responseBody)
            .log("Unwritten bulk request");
    }

    private static String recordIds(List<BulkDocSection> docs, int limit) {
        return docs.stream()
            .limit(limit)
            .map(BulkDocSection::getDocId)
            .collect(Collectors.joining(","));
    }

    private static Throwable rootCause(Throwable error) {
        var current = error;
        while (current != null && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
