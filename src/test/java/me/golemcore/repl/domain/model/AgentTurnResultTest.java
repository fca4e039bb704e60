package me.golemcore.repl.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentTurnResultTest {

    @Test
    void emptySummaryWithoutToolCalls() {
        assertEquals("", AgentTurnResult.builder().aborted(true).build().formatAbortSummary());
    }

    @Test
    void listsUniqueSuccessfulTools() {
        AgentTurnResult result = withCalls(ok("read_file"), ok("bash_exec"), ok("read_file"));

        assertEquals("Completed 3 tool(s) before cancellation: [read_file, bash_exec]", result.formatAbortSummary());
    }

    @Test
    void reportsFailures() {
        AgentTurnResult result = withCalls(ok("read_file"), failed("bash_exec"), failed("write_file"));

        assertEquals("Completed 1 tool(s) before cancellation: [read_file] (2 failed)", result.formatAbortSummary());
    }

    @Test
    void onlyFailures() {
        assertEquals("Completed 0 tool(s) before cancellation (1 failed)",
                withCalls(failed("bash_exec")).formatAbortSummary());
    }

    @Test
    void collapsesLongToolLists() {
        AgentTurnResult result = withCalls(ok("a"), ok("b"), ok("c"), ok("d"), ok("e"), ok("f"), ok("g"));

        assertEquals("Completed 7 tool(s) before cancellation: [a, b, c, d, +3 more]", result.formatAbortSummary());
    }

    @Test
    void fiveToolsAreListedInFull() {
        AgentTurnResult result = withCalls(ok("a"), ok("b"), ok("c"), ok("d"), ok("e"));

        assertEquals("Completed 5 tool(s) before cancellation: [a, b, c, d, e]", result.formatAbortSummary());
    }

    @Test
    void stopReasonHelpers() {
        assertTrue(AgentTurnResult.builder().stopReason(TurnStopReason.COMPLETED).build().isCompleted());
        assertTrue(AgentTurnResult.builder().stopReason(TurnStopReason.MAX_ITERATIONS).build()
                .isIterationLimitReached());
        assertTrue(AgentTurnResult.builder().build().getToolCalls().isEmpty());
    }

    private static AgentTurnResult withCalls(ExecutedToolCall... calls) {
        return AgentTurnResult.builder().aborted(true).toolCalls(new ArrayList<>(List.of(calls))).build();
    }

    private static ExecutedToolCall ok(String name) {
        return new ExecutedToolCall(name + "-id", name, Map.of(), ToolResult.success("ok"), Duration.ofMillis(3));
    }

    private static ExecutedToolCall failed(String name) {
        return new ExecutedToolCall(name + "-id", name, Map.of(), ToolResult.failure("nope"), Duration.ZERO);
    }
}
