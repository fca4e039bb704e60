package me.golemcore.repl.domain.input;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.repl.domain.model.QueuedMessage;
import me.golemcore.repl.port.inbound.InputDriverPort;
import me.golemcore.repl.port.outbound.StatusLinePort;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Assembles raw keystrokes typed while the agent works into lines and queues
 * them for the turn loop.
 *
 * <p>
 * Line editing rules:
 * <ul>
 * <li>CR or LF completes the line. It is trimmed and queued unless empty.</li>
 * <li>Backspace (DEL or BS) removes the last character.</li>
 * <li>Ctrl-U clears the line; Ctrl-W deletes the previous word.</li>
 * <li>Escape sequences (arrows, function keys) are skipped.</li>
 * <li>Other control characters, Ctrl-C included, are ignored. Tab is kept.</li>
 * </ul>
 * Every change re-renders the status line. While the agent is working, a timer
 * advances a spinner frame.
 *
 * <p>
 * Input arrives on the driver's thread while the turn loop runs on another, so
 * all state changes are serialized on this instance.
 */
@Slf4j
public class ConcurrentInputCapture {

    static final String PROMPT = "Type to interrupt";
    static final String[] SPINNER_FRAMES = { "⠋", "⠙", "⠹", "⠸", "⠼", "⠴", "⠦", "⠧", "⠇", "⠏" };

    private static final int CR = '\r';
    private static final int LF = '\n';
    private static final int BACKSPACE = 0x08;
    private static final int DELETE = 0x7f;
    private static final int CTRL_U = 0x15;
    private static final int CTRL_W = 0x17;
    private static final int ESC = 0x1b;
    private static final int TAB = 0x09;

    private final InputDriverPort inputDriver;
    private final StatusLinePort statusLine;
    private final MessageQueue queue;
    private final ScheduledExecutorService scheduler;
    private final boolean bell;
    private final long animationIntervalMs;
    private final Clock clock;

    private CaptureState state = CaptureState.IDLE;
    private final StringBuilder buffer = new StringBuilder();
    private Consumer<QueuedMessage> onMessage;
    private boolean suspended;
    private boolean working;
    private int frame;
    private ScheduledFuture<?> animation;

    public ConcurrentInputCapture(InputDriverPort inputDriver, StatusLinePort statusLine, MessageQueue queue,
            ScheduledExecutorService scheduler, boolean bell, long animationIntervalMs, Clock clock) {
        this.inputDriver = inputDriver;
        this.statusLine = statusLine;
        this.queue = queue;
        this.scheduler = scheduler;
        this.bell = bell;
        this.animationIntervalMs = animationIntervalMs;
        this.clock = clock;
    }

    /**
     * Starts capturing. No-op if already capturing.
     *
     * @param callback
     *            invoked for every completed line after it is queued; may be
     *            null
     */
    public void start(Consumer<QueuedMessage> callback) {
        synchronized (this) {
            if (state == CaptureState.CAPTURING) {
                return;
            }
            state = CaptureState.CAPTURING;
            onMessage = callback;
            buffer.setLength(0);
            suspended = false;
            frame = 0;
            if (animationIntervalMs > 0) {
                animation = scheduler.scheduleAtFixedRate(this::tickAnimation, animationIntervalMs,
                        animationIntervalMs, TimeUnit.MILLISECONDS);
            }
            render();
        }
        inputDriver.start(this::handleInput);
        log.debug("[Capture] Started");
    }

    /**
     * Stops capturing, tears down the driver and timer, clears the status line,
     * and returns whatever is still queued.
     */
    public List<QueuedMessage> stop() {
        boolean wasCapturing;
        synchronized (this) {
            wasCapturing = state == CaptureState.CAPTURING;
            if (wasCapturing) {
                state = CaptureState.STOPPED;
                teardown();
            }
        }
        if (wasCapturing) {
            inputDriver.stop();
            log.debug("[Capture] Stopped");
        }
        return queue.drain();
    }

    /**
     * Temporarily releases the terminal, e.g. while a confirmation prompt reads
     * a line. Buffer and queue are preserved.
     */
    public void suspend() {
        synchronized (this) {
            if (state != CaptureState.CAPTURING || suspended) {
                return;
            }
            suspended = true;
            statusLine.clear();
        }
        inputDriver.stop();
    }

    public void resumeCapture() {
        synchronized (this) {
            if (state != CaptureState.CAPTURING || !suspended) {
                return;
            }
            suspended = false;
            render();
        }
        inputDriver.start(this::handleInput);
    }

    /**
     * Returns to idle for reuse in the next turn, discarding buffer and queue.
     */
    public void reset() {
        boolean wasCapturing;
        synchronized (this) {
            wasCapturing = state == CaptureState.CAPTURING;
            teardown();
            state = CaptureState.IDLE;
            queue.clear();
        }
        if (wasCapturing) {
            inputDriver.stop();
        }
    }

    /**
     * Processes one raw input unit from the driver.
     */
    public synchronized void handleInput(String data) {
        if (state != CaptureState.CAPTURING || suspended || data == null) {
            return;
        }

        int[] codePoints = data.codePoints().toArray();
        for (int i = 0; i < codePoints.length; i++) {
            int code = codePoints[i];
            if (code == CR || code == LF) {
                completeLine();
            } else if (code == DELETE || code == BACKSPACE) {
                if (buffer.length() > 0) {
                    buffer.setLength(buffer.offsetByCodePoints(buffer.length(), -1));
                }
            } else if (code == CTRL_U) {
                buffer.setLength(0);
            } else if (code == CTRL_W) {
                deletePreviousWord();
            } else if (code == ESC) {
                i = skipEscapeSequence(codePoints, i);
            } else if (code >= 0x20 || code == TAB) {
                buffer.appendCodePoint(code);
            }
        }
        render();
    }

    public synchronized void setWorking(boolean working) {
        this.working = working;
        if (state == CaptureState.CAPTURING) {
            render();
        }
    }

    /**
     * Advances the spinner while working. Called by the animation timer.
     */
    public synchronized void tickAnimation() {
        if (state != CaptureState.CAPTURING || !working) {
            return;
        }
        frame = (frame + 1) % SPINNER_FRAMES.length;
        render();
    }

    public synchronized CaptureState getState() {
        return state;
    }

    public synchronized String getCurrentBuffer() {
        return buffer.toString();
    }

    public synchronized boolean isWorking() {
        return working;
    }

    public MessageQueue getQueue() {
        return queue;
    }

    /**
     * Status line text, e.g. {@code ⠙ Type to interrupt › add tests_ (1 queued)}.
     */
    synchronized String statusText() {
        StringBuilder text = new StringBuilder();
        if (working) {
            text.append(SPINNER_FRAMES[frame]).append(' ');
        }
        text.append(PROMPT).append(" › ").append(buffer).append('_');
        int queued = queue.size();
        if (queued > 0) {
            text.append(" (").append(queued).append(" queued)");
        }
        return text.toString();
    }

    private void completeLine() {
        String line = buffer.toString().trim();
        buffer.setLength(0);
        if (line.isEmpty()) {
            return;
        }
        QueuedMessage message = new QueuedMessage(line, clock.instant());
        queue.enqueue(message);
        log.debug("[Capture] Queued message ({} pending)", queue.size());
        if (onMessage != null) {
            onMessage.accept(message);
        }
        if (bell) {
            statusLine.bell();
        }
    }

    private void deletePreviousWord() {
        int end = buffer.length();
        while (end > 0 && buffer.charAt(end - 1) == ' ') {
            end--;
        }
        int lastSpace = buffer.lastIndexOf(" ", end - 1);
        buffer.setLength(lastSpace >= 0 && end > 0 ? lastSpace + 1 : 0);
    }

    private int skipEscapeSequence(int[] codePoints, int escIndex) {
        int i = escIndex;
        if (i + 1 < codePoints.length && codePoints[i + 1] == '[') {
            i += 2;
            while (i < codePoints.length && codePoints[i] < 0x40) {
                i++;
            }
            return i; // final byte
        }
        if (i + 2 < codePoints.length && codePoints[i + 1] == 'O') {
            return i + 2; // SS3, e.g. F1-F4
        }
        if (i + 1 < codePoints.length) {
            return i + 1;
        }
        return i;
    }

    private void teardown() {
        if (animation != null) {
            animation.cancel(false);
            animation = null;
        }
        statusLine.clear();
        buffer.setLength(0);
        onMessage = null;
        suspended = false;
        working = false;
    }

    private void render() {
        if (!suspended) {
            statusLine.render(statusText());
        }
    }
}
