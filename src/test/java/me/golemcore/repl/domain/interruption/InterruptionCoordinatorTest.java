package me.golemcore.repl.domain.interruption;

import me.golemcore.repl.domain.input.MessageQueue;
import me.golemcore.repl.domain.model.InterruptionProcessingResult;
import me.golemcore.repl.domain.model.QueuedMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InterruptionCoordinatorTest {

    private static final Instant T0 = Instant.parse("2026-02-01T12:00:00Z");

    private MessageQueue queue;
    private InterruptionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        queue = new MessageQueue(10);
        coordinator = new InterruptionCoordinator(queue, new InterruptionClassifier(), new InterruptionProcessor());
    }

    @Test
    void nothingQueuedYieldsEmpty() {
        assertTrue(coordinator.collect().isEmpty());
    }

    @Test
    void collectDrainsQueue() {
        queue.enqueue(new QueuedMessage("add emojis", T0));
        queue.enqueue(new QueuedMessage("add colors", T0.plusSeconds(1)));

        Optional<InterruptionProcessingResult> result = coordinator.collect();

        assertTrue(result.isPresent());
        assertTrue(queue.isEmpty());
        assertEquals("2 modification(s)", result.get().summary());
        assertTrue(coordinator.collect().isEmpty());
    }

    @Test
    void abortIsReported() {
        queue.enqueue(new QueuedMessage("stop", T0));

        assertTrue(coordinator.collect().orElseThrow().shouldAbort());
    }

    @Test
    void formatContextDelegatesToProcessor() {
        queue.enqueue(new QueuedMessage("fix the bug", T0));

        String context = coordinator.formatContext(coordinator.collect().orElseThrow());

        assertTrue(context.contains("1. fix the bug"));
    }

    @Test
    void pollAbortReportsStopRequest() {
        queue.enqueue(new QueuedMessage("fix the path", T0));
        queue.enqueue(new QueuedMessage("stop", T0.plusSeconds(1)));

        InterruptionProcessingResult result = coordinator.pollAbort().orElseThrow();

        assertTrue(result.shouldAbort());
        assertEquals(1, result.contextMessages().size());
        assertTrue(coordinator.takeCarried().isEmpty());
    }

    @Test
    void pollAbortCarriesOtherInputToCollect() {
        queue.enqueue(new QueuedMessage("add emojis", T0));

        assertTrue(coordinator.pollAbort().isEmpty());
        assertTrue(queue.isEmpty());

        queue.enqueue(new QueuedMessage("add colors", T0.plusSeconds(1)));
        InterruptionProcessingResult result = coordinator.collect().orElseThrow();

        assertEquals("2 modification(s)", result.summary());
        assertTrue(result.contextMessages().get(0).indexOf("add emojis") < result.contextMessages().get(0)
                .indexOf("add colors"));
    }

    @Test
    void carriedInputCanBeTakenBack() {
        queue.enqueue(new QueuedMessage("add emojis", T0));
        coordinator.pollAbort();

        assertEquals(List.of(new QueuedMessage("add emojis", T0)), coordinator.takeCarried());
        assertTrue(coordinator.collect().isEmpty());
    }

    @Test
    void processClassifiesLooseMessages() {
        assertTrue(coordinator.process(List.of(new QueuedMessage("cancel", T0))).shouldAbort());
        assertFalse(coordinator.process(List.of(new QueuedMessage("add tests", T0))).shouldAbort());
    }
}
