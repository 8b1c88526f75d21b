package org.catalogsearch.ingest.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class HandoffQueueTest {

    @Test
    void consumerSeesEveryItemOnceBeforeTheEnd() throws Exception {
        var queue = new HandoffQueue<Integer>(3);
        var executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(() -> {
                for (int i = 0; i < 100; i++) {
                    queue.put(i);
                }
                queue.close();
                return null;
            });

            var received = new ArrayList<Integer>();
            Optional<Integer> next;
            while ((next = queue.take()).isPresent()) {
                received.add(next.get());
            }

            assertEquals(IntStream.range(0, 100).boxed().collect(Collectors.toList()), received);
            assertEquals(Optional.empty(), queue.take());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void closingAFullQueueStillEndsTheStream() throws Exception {
        var queue = new HandoffQueue<String>(1);
        queue.put("only");

        queue.close();

        assertEquals(Optional.of("only"), queue.take());
        assertEquals(Optional.empty(), queue.take());
    }

    @Test
    void putAfterCloseIsRejected() {
        var queue = new HandoffQueue<String>(2);
        queue.close();

        assertThrows(IllegalStateException.class, () -> queue.put("late"));
    }

    @Test
    void abandonReleasesWaitingProducer() throws Exception {
        var queue = new HandoffQueue<String>(1);
        queue.put("first");
        var executor = Executors.newSingleThreadExecutor();
        try {
            var blockedPut = executor.submit(() -> queue.put("second"));

            Thread.sleep(200);
            assertFalse(blockedPut.isDone());
            queue.abandon();

            assertFalse(blockedPut.get(5, TimeUnit.SECONDS));
            assertTrue(queue.isAbandoned());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new HandoffQueue<String>(0));
    }

    static <T> List<T> drain(HandoffQueue<T> queue) throws InterruptedException {
        var items = new ArrayList<T>();
        Optional<T> next;
        while ((next = queue.take()).isPresent()) {
            items.add(next.get());
        }
        return items;
    }
}
