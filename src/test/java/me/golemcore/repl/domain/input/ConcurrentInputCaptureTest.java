package me.golemcore.repl.domain.input;

import me.golemcore.repl.domain.model.QueuedMessage;
import me.golemcore.repl.port.inbound.InputDriverPort;
import me.golemcore.repl.port.outbound.StatusLinePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ConcurrentInputCaptureTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private SyntheticInputDriver driver;
    private StatusLinePort statusLine;
    private ScheduledExecutorService scheduler;
    private MessageQueue queue;
    private ConcurrentInputCapture capture;

    @BeforeEach
    void setUp() {
        driver = new SyntheticInputDriver();
        statusLine = mock(StatusLinePort.class);
        scheduler = mock(ScheduledExecutorService.class);
        queue = new MessageQueue(50);
        capture = newCapture(false, 0);
    }

    // ==================== Lifecycle ====================

    @Test
    void startEntersCapturingAndRendersPrompt() {
        capture.start(null);

        assertEquals(CaptureState.CAPTURING, capture.getState());
        assertTrue(driver.running);
        verify(statusLine).render(contains("Type to interrupt"));
    }

    @Test
    void startIsIdempotent() {
        capture.start(null);
        capture.start(null);

        assertEquals(1, driver.starts);
    }

    @Test
    void stopReturnsQueuedMessagesAndReleasesTerminal() {
        capture.start(null);
        driver.type("add tests\r");

        List<QueuedMessage> leftover = capture.stop();

        assertEquals(CaptureState.STOPPED, capture.getState());
        assertFalse(driver.running);
        verify(statusLine).clear();
        assertEquals(1, leftover.size());
        assertEquals("add tests", leftover.get(0).text());
        assertEquals(NOW, leftover.get(0).timestamp());
        assertTrue(queue.isEmpty());
    }

    @Test
    void stopWithoutStartOnlyDrains() {
        queue.enqueue(new QueuedMessage("stale", NOW));

        assertEquals(1, capture.stop().size());
        assertEquals(0, driver.stops);
    }

    @Test
    void resetReturnsToIdleAndDiscardsQueue() {
        capture.start(null);
        driver.type("pending\r");

        capture.reset();

        assertEquals(CaptureState.IDLE, capture.getState());
        assertTrue(queue.isEmpty());
        assertFalse(driver.running);
    }

    @Test
    void canRestartAfterStop() {
        capture.start(null);
        capture.stop();
        capture.start(null);

        assertEquals(CaptureState.CAPTURING, capture.getState());
        assertEquals(2, driver.starts);
    }

    @Test
    void inputIgnoredWhenNotCapturing() {
        capture.handleInput("ignored\r");

        assertTrue(queue.isEmpty());
        assertEquals("", capture.getCurrentBuffer());
    }

    // ==================== Line assembly ====================

    @Test
    void completedLineIsTrimmedQueuedAndReported() {
        List<QueuedMessage> reported = new ArrayList<>();
        capture.start(reported::add);

        driver.type("  use tabs  \r");

        assertEquals(1, queue.size());
        assertEquals("use tabs", queue.peek().orElseThrow().text());
        assertEquals(1, reported.size());
        assertEquals("", capture.getCurrentBuffer());
    }

    @Test
    void lineFeedAlsoCompletesLine() {
        capture.start(null);
        driver.type("one\ntwo\r");

        assertEquals(List.of("one", "two"), queue.drain().stream().map(QueuedMessage::text).toList());
    }

    @Test
    void blankLineIsNotQueued() {
        capture.start(null);
        driver.type("   \r\r");

        assertTrue(queue.isEmpty());
    }

    @Test
    void backspaceRemovesLastCharacter() {
        capture.start(null);
        driver.type("abc\u007f");
        assertEquals("ab", capture.getCurrentBuffer());

        driver.type("\b");
        assertEquals("a", capture.getCurrentBuffer());

        driver.type("\b\b\b");
        assertEquals("", capture.getCurrentBuffer());
    }

    @Test
    void backspaceRemovesWholeSurrogatePair() {
        capture.start(null);
        driver.type("ok👍\u007f");

        assertEquals("ok", capture.getCurrentBuffer());
    }

    @Test
    void ctrlUClearsBuffer() {
        capture.start(null);
        driver.type("hello world\u0015");

        assertEquals("", capture.getCurrentBuffer());
    }

    @Test
    void ctrlWDeletesPreviousWord() {
        capture.start(null);
        driver.type("fix the bug\u0017");
        assertEquals("fix the ", capture.getCurrentBuffer());

        driver.type("  \u0017");
        assertEquals("fix ", capture.getCurrentBuffer());
    }

    @Test
    void escapeSequencesAreSkipped() {
        capture.start(null);
        driver.type("a\u001b[Ab");
        driver.type("\u001b[1;5Cc");
        driver.type("\u001b[Bd");

        assertEquals("abcd", capture.getCurrentBuffer());
    }

    @Test
    void functionKeySequencesAreSkipped() {
        capture.start(null);
        driver.type("a\u001bOPb");
        driver.type("\u001bOS");

        assertEquals("ab", capture.getCurrentBuffer());
    }

    @Test
    void controlCharactersIgnoredButTabKept() {
        capture.start(null);
        driver.type("a\u0003\u0001\tb");

        assertEquals("a\tb", capture.getCurrentBuffer());
    }

    @Test
    void overflowDropsOldestLine() {
        queue = new MessageQueue(2);
        capture = newCapture(false, 0);
        capture.start(null);

        driver.type("one\rtwo\rthree\r");

        assertEquals(List.of("two", "three"), queue.drain().stream().map(QueuedMessage::text).toList());
    }

    @Test
    void bellRingsOnCapturedLineWhenEnabled() {
        capture = newCapture(true, 0);
        capture.start(null);

        driver.type("hi\r");

        verify(statusLine).bell();
    }

    @Test
    void bellSilentByDefault() {
        capture.start(null);
        driver.type("hi\r");

        verify(statusLine, never()).bell();
    }

    // ==================== Suspend ====================

    @Test
    void suspendReleasesDriverAndIgnoresInput() {
        capture.start(null);
        driver.type("keep");

        capture.suspend();
        capture.handleInput("lost\r");

        assertFalse(driver.running);
        assertTrue(queue.isEmpty());
        assertEquals("keep", capture.getCurrentBuffer());
        assertEquals(CaptureState.CAPTURING, capture.getState());
    }

    @Test
    void resumeRestartsDriver() {
        capture.start(null);
        capture.suspend();
        capture.resumeCapture();

        assertTrue(driver.running);
        driver.type("after\r");
        assertEquals(1, queue.size());
    }

    // ==================== Status line ====================

    @Test
    void statusTextShowsSpinnerBufferAndQueueCount() {
        capture.start(null);
        capture.setWorking(true);
        driver.type("first\rab");

        assertEquals("⠋ Type to interrupt › ab_ (1 queued)", capture.statusText());
    }

    @Test
    void statusTextWithoutSpinnerWhenIdle() {
        capture.start(null);

        assertEquals("Type to interrupt › _", capture.statusText());
    }

    @Test
    void animationAdvancesOnlyWhileWorking() {
        capture.start(null);
        capture.tickAnimation();
        capture.setWorking(true);
        capture.tickAnimation();

        assertTrue(capture.statusText().startsWith("⠙ "));
    }

    @Test
    void animationTimerScheduledAndCancelled() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any());
        capture = newCapture(false, 80);

        capture.start(null);
        capture.stop();

        verify(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(80L), eq(80L), eq(TimeUnit.MILLISECONDS));
        verify(future).cancel(false);
    }

    @Test
    void everyKeystrokeRerenders() {
        capture.start(null);
        driver.type("a");
        driver.type("b");

        verify(statusLine, atLeastOnce()).render("Type to interrupt › ab_");
    }

    private ConcurrentInputCapture newCapture(boolean bell, long animationIntervalMs) {
        return new ConcurrentInputCapture(driver, statusLine, queue, scheduler, bell, animationIntervalMs,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static final class SyntheticInputDriver implements InputDriverPort {

        private Consumer<String> listener;
        private boolean running;
        private int starts;
        private int stops;

        @Override
        public void start(Consumer<String> listener) {
            this.listener = listener;
            running = true;
            starts++;
        }

        @Override
        public void stop() {
            running = false;
            stops++;
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        void type(String data) {
            if (running) {
                listener.accept(data);
            }
        }
    }
}
