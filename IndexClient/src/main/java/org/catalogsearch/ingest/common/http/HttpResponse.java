package org.catalogsearch.ingest.common.http;

import java.util.Map;

/**
 * Status, headers and body of a completed request. Header values that repeat are joined with
 * commas.
 */
public class HttpResponse {
    private static final int MAX_BODY_IN_TO_STRING = 2000;

    public final int statusCode;
    public final String statusText;
    public final Map<String, String> headers;
    public final String body;

    public HttpResponse(int statusCode, String statusText, Map<String, String> headers, String body) {
        this.statusCode = statusCode;
        this.statusText = statusText;
        this.headers = headers == null ? Map.of() : headers;
        this.body = body;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /** Bodies longer than 2000 characters are cut. */
    @Override
    public String toString() {
        var shownBody = body != null && body.length() > MAX_BODY_IN_TO_STRING
            ? body.substring(0, MAX_BODY_IN_TO_STRING) + "... [" + body.length() + " chars]"
            : body;
        return "HttpResponse(" + statusCode + " " + statusText + ", body=" + shownBody + ")";
    }
}
