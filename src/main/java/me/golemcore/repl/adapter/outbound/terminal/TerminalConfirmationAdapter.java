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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.repl.domain.input.ConcurrentInputCapture;
import me.golemcore.repl.domain.model.ConfirmationDecision;
import me.golemcore.repl.domain.model.Message;
import me.golemcore.repl.port.outbound.ConfirmationPort;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Terminal implementation of {@link ConfirmationPort}.
 *
 * <p>
 * Suspends concurrent input capture while the prompt reads a line, so the
 * answer is not mistaken for an interruption. Ctrl-C or end of input at the
 * prompt aborts the turn.
 */
@Slf4j
public class TerminalConfirmationAdapter implements ConfirmationPort {

    static final String CHOICES = "  Allow? [y]es / [n]o / [a]ll this turn / [t]rust for session / [c]ancel turn: ";

    private final LineReader lineReader;
    private final ConcurrentInputCapture inputCapture;

    public TerminalConfirmationAdapter(LineReader lineReader, ConcurrentInputCapture inputCapture) {
        this.lineReader = lineReader;
        this.inputCapture = inputCapture;
    }

    @Override
    public CompletableFuture<ConfirmationDecision> requestConfirmation(Message.ToolCall toolCall,
            String description) {
        inputCapture.suspend();
        try {
            lineReader.printAbove("⚠ " + toolCall.getName() + " wants to run: " + description);
            String answer = lineReader.readLine(CHOICES);
            return CompletableFuture.completedFuture(parseDecision(answer));
        } catch (UserInterruptException | EndOfFileException e) {
            log.debug("[Confirm] Prompt interrupted, aborting turn");
            return CompletableFuture.completedFuture(ConfirmationDecision.ABORT);
        } finally {
            inputCapture.resumeCapture();
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    /**
     * Maps a typed answer to a decision. Anything unrecognised, including an
     * empty line, declines.
     */
    static ConfirmationDecision parseDecision(String answer) {
        if (answer == null) {
            return ConfirmationDecision.NO;
        }
        return switch (answer.trim().toLowerCase(Locale.ROOT)) {
        case "y", "yes" -> ConfirmationDecision.YES;
        case "a", "all" -> ConfirmationDecision.YES_ALL;
        case "t", "trust" -> ConfirmationDecision.TRUST_SESSION;
        case "c", "cancel", "abort" -> ConfirmationDecision.ABORT;
        default -> ConfirmationDecision.NO;
        };
    }
}
