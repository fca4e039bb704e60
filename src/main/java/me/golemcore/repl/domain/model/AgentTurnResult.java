package me.golemcore.repl.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structured outcome of one agent turn.
 *
 * <p>
 * Every way a turn can stop yields this shape. Aborts never throw: they set
 * {@link #aborted}, carry the text accumulated so far in
 * {@link #partialContent}, and keep the tool calls completed before the abort.
 * A turn that hit the iteration limit is reported with {@code aborted=false}
 * and {@link TurnStopReason#MAX_ITERATIONS} so callers can tell it apart from a
 * natural completion.
 */
@Data
@Builder
public class AgentTurnResult {

    public static final String ABORT_REASON_USER_CANCEL = "user_cancel";
    public static final String ABORT_REASON_USER_INTERRUPT = "user_interrupt";

    private static final int MAX_LISTED_TOOLS = 5;

    private String content;

    @Builder.Default
    private List<ExecutedToolCall> toolCalls = new ArrayList<>();

    @Builder.Default
    private LlmUsage usage = LlmUsage.empty();

    private boolean aborted;
    private String partialContent;
    private String abortReason;
    private TurnStopReason stopReason;
    private int iterations;

    public boolean isCompleted() {
        return stopReason == TurnStopReason.COMPLETED;
    }

    public boolean isIterationLimitReached() {
        return stopReason == TurnStopReason.MAX_ITERATIONS;
    }

    /**
     * Describes what got done before an aborted turn stopped, e.g.
     * {@code Completed 3 tool(s) before cancellation: [read_file, bash_exec] (1 failed)}.
     * Returns an empty string when no tool call was made.
     */
    public String formatAbortSummary() {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return "";
        }

        Set<String> succeededNames = new LinkedHashSet<>();
        int failed = 0;
        for (ExecutedToolCall call : toolCalls) {
            if (call.isSuccess()) {
                succeededNames.add(call.name());
            } else {
                failed++;
            }
        }

        StringBuilder summary = new StringBuilder();
        summary.append("Completed ").append(toolCalls.size() - failed).append(" tool(s) before cancellation");
        if (!succeededNames.isEmpty()) {
            summary.append(": [").append(formatNames(new ArrayList<>(succeededNames))).append(']');
        }
        if (failed > 0) {
            summary.append(" (").append(failed).append(" failed)");
        }
        return summary.toString();
    }

    private static String formatNames(List<String> names) {
        if (names.size() <= MAX_LISTED_TOOLS) {
            return String.join(", ", names);
        }
        List<String> shown = names.subList(0, MAX_LISTED_TOOLS - 1);
        return String.join(", ", shown) + ", +" + (names.size() - shown.size()) + " more";
    }
}
