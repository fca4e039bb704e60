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

import me.golemcore.repl.adapter.outbound.terminal.TerminalStatusLineRenderer;
import me.golemcore.repl.domain.model.ExecutedToolCall;
import me.golemcore.repl.domain.model.InterruptionProcessingResult;
import me.golemcore.repl.domain.model.Message;
import me.golemcore.repl.domain.system.toolloop.AgentTurnListener;

/**
 * Prints turn progress above the capture status line.
 */
class ConsoleTurnListener implements AgentTurnListener {

    private static final int MAX_ERROR_LENGTH = 200;

    private final TerminalStatusLineRenderer output;

    ConsoleTurnListener(TerminalStatusLineRenderer output) {
        this.output = output;
    }

    @Override
    public void onStream(String chunk) {
        output.printAbove(chunk.stripTrailing());
    }

    @Override
    public void onToolStart(Message.ToolCall toolCall, int index, int total) {
        String position = total > 1 ? " (" + (index + 1) + "/" + total + ")" : "";
        output.printAbove("→ " + toolCall.getName() + position);
    }

    @Override
    public void onToolEnd(ExecutedToolCall executedCall) {
        long millis = executedCall.duration() != null ? executedCall.duration().toMillis() : 0;
        if (executedCall.isSuccess()) {
            output.printAbove("✓ " + executedCall.name() + " (" + millis + "ms)");
        } else {
            output.printAbove("✗ " + executedCall.name() + ": " + abbreviate(executedCall.result().getError()));
        }
    }

    @Override
    public void onToolSkipped(Message.ToolCall toolCall, String reason) {
        output.printAbove("⊘ " + toolCall.getName() + ": " + reason);
    }

    @Override
    public void onInterruptionsProcessed(InterruptionProcessingResult result) {
        output.printAbove("↳ " + result.summary());
        if (result.shouldAbort() && result.hasContext()) {
            output.printAbove("  Not applied:");
            for (String context : result.contextMessages()) {
                output.printAbove(context);
            }
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "Unknown error";
        }
        return text.length() > MAX_ERROR_LENGTH ? text.substring(0, MAX_ERROR_LENGTH) + "..." : text;
    }
}
