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

package me.golemcore.repl.adapter.inbound.terminal;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.repl.port.inbound.InputDriverPort;
import org.jline.terminal.Attributes;
import org.jline.terminal.Terminal;
import org.jline.utils.NonBlockingReader;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Raw-mode keystroke reader on top of a JLine {@link Terminal}.
 *
 * <p>
 * While running, the terminal is in raw mode (no echo, no line buffering) and
 * a daemon thread polls the non-blocking reader. Characters that arrive in one
 * burst, such as an escape sequence or a paste, are delivered as one chunk.
 * {@link #stop()} waits for the reader thread so a following line prompt does
 * not lose keystrokes, then restores the terminal attributes.
 */
@Slf4j
public class JLineInputDriver implements InputDriverPort {

    private static final long POLL_TIMEOUT_MS = 100;
    private static final long BURST_TIMEOUT_MS = 2;
    private static final long JOIN_TIMEOUT_MS = 500;

    private final Terminal terminal;

    private volatile boolean running;
    private Thread readerThread;
    private Attributes savedAttributes;

    public JLineInputDriver(Terminal terminal) {
        this.terminal = terminal;
    }

    @Override
    public synchronized void start(Consumer<String> listener) {
        if (running) {
            return;
        }
        Attributes previous = terminal.enterRawMode();
        if (savedAttributes == null) {
            savedAttributes = previous;
        }
        running = true;
        readerThread = new Thread(() -> readLoop(listener), "repl-input-reader");
        readerThread.setDaemon(true);
        readerThread.start();
    }

    @Override
    public void stop() {
        Thread thread;
        synchronized (this) {
            running = false;
            thread = readerThread;
            readerThread = null;
        }
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        synchronized (this) {
            if (savedAttributes != null) {
                terminal.setAttributes(savedAttributes);
                savedAttributes = null;
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void readLoop(Consumer<String> listener) {
        NonBlockingReader reader = terminal.reader();
        while (running) {
            try {
                int c = reader.read(POLL_TIMEOUT_MS);
                if (c == NonBlockingReader.EOF) {
                    log.debug("[Capture] Terminal input closed");
                    running = false;
                    return;
                }
                if (c == NonBlockingReader.READ_EXPIRED || !running) {
                    continue;
                }
                StringBuilder chunk = new StringBuilder().append((char) c);
                while (reader.peek(BURST_TIMEOUT_MS) >= 0) {
                    chunk.append((char) reader.read());
                }
                listener.accept(chunk.toString());
            } catch (IOException e) {
                log.warn("[Capture] Terminal read failed, stopping input capture: {}", e.getMessage());
                running = false;
                return;
            } catch (RuntimeException e) {
                log.error("[Capture] Input listener failed", e);
            }
        }
    }
}
