package org.catalogsearch.ingest.common;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BulkResponseParserTest {

    @Test
    void findsPositionsOfSuccessfulItems() throws IOException {
        var body = "{\"took\":30,\"errors\":true,\"items\":["
            + "{\"index\":{\"_index\":\"aleph\",\"_id\":\"1\",\"result\":\"created\",\"status\":201}},"
            + "{\"index\":{\"_index\":\"aleph\",\"_id\":\"2\",\"status\":400,"
            + "\"error\":{\"type\":\"mapper_parsing_exception\",\"reason\":\"failed to parse\"}}},"
            + "{\"index\":{\"_index\":\"aleph\",\"_id\":\"3\",\"result\":\"updated\",\"status\":200,"
            + "\"_shards\":{\"total\":2,\"successful\":1,\"failed\":0}}}"
            + "]}";

        assertEquals(List.of(0, 2), BulkResponseParser.findSuccessfulPositions(body));
    }

    @Test
    void duplicateIdsAreCountedByPosition() throws IOException {
        var body = "{\"errors\":false,\"items\":["
            + "{\"index\":{\"_id\":\"same\",\"result\":\"created\",\"status\":201}},"
            + "{\"index\":{\"_id\":\"same\",\"result\":\"updated\",\"status\":200}}"
            + "]}";

        assertEquals(List.of(0, 1), BulkResponseParser.findSuccessfulPositions(body));
    }

    @Test
    void itemsWithoutResultUseStatus() throws IOException {
        var body = "{\"items\":[{\"index\":{\"status\":201}},{\"index\":{\"status\":503}}]}";

        assertEquals(List.of(0), BulkResponseParser.findSuccessfulPositions(body));
    }

    @Test
    void responseWithoutItemsHasNoSuccesses() throws IOException {
        assertEquals(List.of(), BulkResponseParser.findSuccessfulPositions("{\"error\":\"Cannot Process Error!\"}"));
    }

    @Test
    void nonObjectResponseIsRejected() {
        assertThrows(IOException.class, () -> BulkResponseParser.findSuccessfulPositions("[]"));
    }
}
