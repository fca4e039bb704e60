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

package me.golemcore.repl.adapter.outbound.terminal;

import me.golemcore.repl.port.outbound.StatusLinePort;
import org.jline.terminal.Terminal;
import org.jline.utils.InfoCmp;

import java.io.PrintWriter;

/**
 * Renders the capture status line on the last terminal row, using carriage
 * return and erase-line so it is redrawn in place.
 *
 * <p>
 * All terminal output of a turn goes through this class, so text printed by
 * the turn and status redraws from the input and animation threads never
 * interleave.
 */
public class TerminalStatusLineRenderer implements StatusLinePort {

    private static final String ERASE_LINE = "\r\u001B[2K";

    private final Terminal terminal;
    private String current;

    public TerminalStatusLineRenderer(Terminal terminal) {
        this.terminal = terminal;
    }

    @Override
    public synchronized void render(String text) {
        current = text;
        draw();
    }

    @Override
    public synchronized void clear() {
        if (current != null) {
            PrintWriter writer = terminal.writer();
            writer.print(ERASE_LINE);
            writer.flush();
            current = null;
        }
    }

    @Override
    public synchronized void bell() {
        terminal.puts(InfoCmp.Capability.bell);
        terminal.flush();
    }

    /**
     * Prints {@code text} above the status line and redraws the status line
     * below it.
     */
    public synchronized void printAbove(String text) {
        PrintWriter writer = terminal.writer();
        writer.print(ERASE_LINE);
        writer.println(text);
        writer.flush();
        if (current != null) {
            draw();
        }
    }

    private void draw() {
        PrintWriter writer = terminal.writer();
        writer.print(ERASE_LINE);
        writer.print(fit(current));
        writer.flush();
    }

    private String fit(String text) {
        int width = terminal.getWidth();
        if (width <= 1 || text.length() < width) {
            return text;
        }
        return "…" + text.substring(text.length() - (width - 2));
    }
}
