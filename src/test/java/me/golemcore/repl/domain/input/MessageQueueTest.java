package me.golemcore.repl.domain.input;

import me.golemcore.repl.domain.model.QueuedMessage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MessageQueueTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void dequeuesInArrivalOrder() {
        MessageQueue queue = new MessageQueue(5);
        queue.enqueue(message("first", 0));
        queue.enqueue(message("second", 1));

        assertEquals("first", queue.dequeue().orElseThrow().text());
        assertEquals("second", queue.dequeue().orElseThrow().text());
        assertTrue(queue.dequeue().isEmpty());
    }

    @Test
    void overflowDropsOldestNeverNewest() {
        MessageQueue queue = new MessageQueue(3);
        for (int i = 0; i < 5; i++) {
            queue.enqueue(message("m" + i, i));
        }

        assertEquals(3, queue.size());
        List<QueuedMessage> drained = queue.drain();
        assertEquals(List.of("m2", "m3", "m4"), drained.stream().map(QueuedMessage::text).toList());
    }

    @Test
    void drainEmptiesQueue() {
        MessageQueue queue = new MessageQueue();
        queue.enqueue(message("a", 0));
        queue.enqueue(message("b", 1));

        assertEquals(2, queue.drain().size());
        assertTrue(queue.isEmpty());
        assertTrue(queue.drain().isEmpty());
    }

    @Test
    void peekDoesNotRemove() {
        MessageQueue queue = new MessageQueue();
        queue.enqueue(message("a", 0));

        assertEquals("a", queue.peek().orElseThrow().text());
        assertEquals(1, queue.size());
    }

    @Test
    void clearDiscardsEverything() {
        MessageQueue queue = new MessageQueue();
        queue.enqueue(message("a", 0));
        queue.clear();

        assertTrue(queue.isEmpty());
        assertTrue(queue.peek().isEmpty());
    }

    @Test
    void defaultCapacity() {
        assertEquals(MessageQueue.DEFAULT_MAX_SIZE, new MessageQueue().getMaxSize());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new MessageQueue(0));
    }

    @Test
    void concurrentProducersNeverExceedCapacity() throws InterruptedException {
        MessageQueue queue = new MessageQueue(10);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        for (int t = 0; t < 4; t++) {
            executor.execute(() -> {
                for (int i = 0; i < 250; i++) {
                    queue.enqueue(message("x", i));
                }
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();
        assertEquals(10, queue.size());
    }

    private static QueuedMessage message(String text, int secondsAfterStart) {
        return new QueuedMessage(text, T0.plusSeconds(secondsAfterStart));
    }
}
