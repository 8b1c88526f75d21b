package org.catalogsearch.ingest.common;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@UtilityClass
public class BulkResponseParser {
    private static final JsonFactory jsonFactory = new JsonFactory();

    /**
     * Scans a bulk response for the operations that succeeded.  Items are reported in request
     * order, so the position of an item identifies the document it belongs to.
     *
     * <pre>
     * {
     *   "items": [
     *     { "index": { "_id": "990012345", "result": "created", "status": 201 } },
     *     { "index": { "_id": "990012346", "status": 400, "error": { ... } } }
     * </pre>
     *
     * @param bulkResponse The response to scan
     * @return The zero-based positions of the items that succeeded
     * @throws IOException If the response is not a JSON object
     */
    public static List<Integer> findSuccessfulPositions(String bulkResponse) throws IOException {
        var successfulPositions = new ArrayList<Integer>();
        try (var parser = jsonFactory.createParser(bulkResponse)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IOException("Expected data to start with an Object");
            }

            try {
                while (parser.nextToken() != JsonToken.END_OBJECT) {
                    var fieldName = parser.currentName();
                    parser.nextToken();
                    if ("items".equals(fieldName)) {
                        scanItems(parser, successfulPositions);
                    } else {
                        parser.skipChildren();
                    }
                }
            } catch (IOException ioe) {
                log.warn("Unable to finish parsing the entire bulk response body", ioe);
            }
        }
        return successfulPositions;
    }

    private static void scanItems(JsonParser parser, List<Integer> successfulPositions) throws IOException {
        if (parser.currentToken() != JsonToken.START_ARRAY) {
            throw new IOException("Expected 'items' to be an array");
        }

        int position = 0;
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            if (parser.currentToken() == JsonToken.START_OBJECT) {
                // Each item is an object with one key naming the action
                parser.nextToken();
                if (parser.nextToken() == JsonToken.START_OBJECT && isSuccess(parser)) {
                    successfulPositions.add(position);
                } else {
                    parser.skipChildren();
                }
                while (parser.nextToken() != JsonToken.END_OBJECT) {
                    parser.nextToken();
                    parser.skipChildren();
                }
            } else {
                parser.skipChildren();
            }
            position++;
        }
    }

    private static boolean isSuccess(JsonParser parser) throws IOException {
        String result = null;
        Integer status = null;
        boolean hasError = false;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            var innerFieldName = parser.currentName();
            parser.nextToken();
            if ("result".equals(innerFieldName)) {
                result = parser.getText();
            } else if ("status".equals(innerFieldName)) {
                status = parser.getIntValue();
            } else if ("error".equals(innerFieldName)) {
                hasError = true;
                parser.skipChildren();
            } else {
                parser.skipChildren();
            }
        }
        if (hasError) {
            return false;
        }
        return result != null || (status != null && status >= 200 && status < 300);
    }
}
