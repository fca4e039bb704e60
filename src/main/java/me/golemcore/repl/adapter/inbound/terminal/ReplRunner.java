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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.repl.adapter.outbound.terminal.TerminalStatusLineRenderer;
import me.golemcore.repl.domain.input.ConcurrentInputCapture;
import me.golemcore.repl.domain.interruption.InterruptionCoordinator;
import me.golemcore.repl.domain.model.AgentTurnResult;
import me.golemcore.repl.domain.model.InterruptionProcessingResult;
import me.golemcore.repl.domain.model.QueuedMessage;
import me.golemcore.repl.domain.model.ReplSession;
import me.golemcore.repl.domain.service.RiskModeService;
import me.golemcore.repl.domain.service.SessionService;
import me.golemcore.repl.domain.system.toolloop.AbortSignal;
import me.golemcore.repl.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.repl.domain.system.toolloop.TurnOptions;
import me.golemcore.repl.port.outbound.LlmPort;
import me.golemcore.repl.port.outbound.ToolRegistryPort;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Interactive read-eval loop.
 *
 * <p>
 * Reads a line with JLine, runs one agent turn, and captures typed input
 * concurrently while the turn works. Ctrl-C during a turn cancels it; at the
 * prompt it only clears the line. Lines queued after the last iteration
 * boundary of a turn become the next input: they run at once after a finished
 * turn, are offered as editable input after a cancelled one, and are dropped
 * when they contain a stop request.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReplRunner implements CommandLineRunner {

    static final String PROMPT = "› ";

    private final Terminal terminal;
    private final LineReader lineReader;
    private final TerminalStatusLineRenderer statusLine;
    private final ConcurrentInputCapture inputCapture;
    private final InterruptionCoordinator interruptionCoordinator;
    private final ToolLoopSystem toolLoopSystem;
    private final SessionService sessionService;
    private final RiskModeService riskModeService;
    private final LlmPort llmPort;
    private final ToolRegistryPort toolRegistry;

    @Override
    public void run(String... args) {
        boolean riskMode = riskModeService.loadPreference();
        String projectPath = Path.of("").toAbsolutePath().toString();
        ReplSession session = sessionService.createSession(projectPath);
        log.info("[Session] Started session {} in {}", session.getId(), projectPath);

        println("GolemCore REPL (" + llmPort.getProviderId() + "). Type 'exit' to quit.");
        if (riskMode) {
            println("Full-power risk mode is ON: unblocked shell commands run without confirmation.");
        }

        PendingInput pending = null;
        while (true) {
            String input;
            if (pending != null && pending.runNow()) {
                input = pending.text();
                pending = null;
                println(PROMPT + input);
            } else {
                String prefill = pending != null ? pending.text() : null;
                pending = null;
                try {
                    input = prefill != null
                            ? lineReader.readLine(PROMPT, (Character) null, prefill)
                            : lineReader.readLine(PROMPT);
                } catch (UserInterruptException e) {
                    continue;
                } catch (EndOfFileException e) {
                    break;
                }
            }
            if (input == null || input.isBlank()) {
                continue;
            }
            if (isExitCommand(input)) {
                break;
            }
            pending = runTurn(session, input.trim());
        }
        log.info("[Session] Session {} ended", session.getId());
    }

    /**
     * Runs one turn and returns the input typed too late to be merged into it,
     * or null when there is none or it asked to stop.
     */
    PendingInput runTurn(ReplSession session, String input) {
        AbortSignal abortSignal = new AbortSignal();
        Terminal.SignalHandler previous = terminal.handle(Terminal.Signal.INT, signal -> abortSignal.abort());
        TurnOptions options = TurnOptions.builder()
                .listener(new ConsoleTurnListener(statusLine))
                .abortSignal(abortSignal)
                .interruptions(interruptionCoordinator)
                .build();

        AgentTurnResult result = null;
        List<QueuedMessage> captured;
        inputCapture.start(null);
        inputCapture.setWorking(true);
        try {
            result = toolLoopSystem.executeTurn(session, input, llmPort, toolRegistry, options);
        } catch (RuntimeException e) {
            log.error("[Session] Turn failed", e);
            statusLine.printAbove("Error: " + e.getMessage());
        } finally {
            captured = inputCapture.stop();
            terminal.handle(Terminal.Signal.INT, previous);
        }

        if (result != null) {
            reportOutcome(result);
        }
        return pendingInput(result, captured);
    }

    private PendingInput pendingInput(AgentTurnResult result, List<QueuedMessage> captured) {
        List<QueuedMessage> leftover = new ArrayList<>(interruptionCoordinator.takeCarried());
        leftover.addAll(captured);
        if (leftover.isEmpty()) {
            return null;
        }
        InterruptionProcessingResult processed = interruptionCoordinator.process(leftover);
        if (processed.shouldAbort()) {
            log.info("[Interrupt] Dropped {} queued message(s) containing a stop request", leftover.size());
            println("Discarded " + leftover.size() + " queued message(s): stop requested.");
            return null;
        }
        boolean runNow = result != null && !result.isAborted();
        String text = leftover.stream()
                .map(QueuedMessage::text)
                .collect(Collectors.joining(runNow ? "\n" : " "));
        return new PendingInput(text, runNow);
    }

    private void reportOutcome(AgentTurnResult result) {
        if (result.isAborted()) {
            String summary = result.formatAbortSummary();
            String reason = AgentTurnResult.ABORT_REASON_USER_INTERRUPT.equals(result.getAbortReason())
                    ? "Stopped at your request."
                    : "Cancelled.";
            println(summary.isEmpty() ? reason : reason + " " + summary);
        } else if (result.isIterationLimitReached()) {
            println("Stopped after " + result.getIterations() + " iterations; the task may be incomplete.");
        }
    }

    private void println(String text) {
        terminal.writer().println(text);
        terminal.writer().flush();
    }

    static boolean isExitCommand(String input) {
        String command = input.trim().toLowerCase(Locale.ROOT);
        return "exit".equals(command) || "quit".equals(command);
    }

    /**
     * Input left over from a turn. Runs as the next prompt when
     * {@code runNow}, otherwise pre-fills the prompt line.
     */
    record PendingInput(String text, boolean runNow) {
    }
}
