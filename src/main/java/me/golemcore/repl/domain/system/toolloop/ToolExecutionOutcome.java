package me.golemcore.repl.domain.system.toolloop;

import me.golemcore.repl.domain.model.ExecutedToolCall;
import me.golemcore.repl.domain.model.Message;
import me.golemcore.repl.domain.model.ToolFailureKind;
import me.golemcore.repl.domain.model.ToolResult;

import java.time.Duration;

/**
 * Result of a single tool call within a turn (executed or synthetic).
 *
 * @param toolCall
 *            the call as requested by the LLM
 * @param toolResult
 *            raw ToolResult (success/failure + structured data)
 * @param messageContent
 *            content written into the tool-result block
 * @param duration
 *            wall time of the execution, zero for synthetic results
 */
public record ToolExecutionOutcome(Message.ToolCall toolCall, ToolResult toolResult, String messageContent,
        Duration duration) {

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        return new ToolExecutionOutcome(toolCall, ToolResult.failure(kind, reason), reason, Duration.ZERO);
    }

    public ExecutedToolCall toExecutedToolCall() {
        return new ExecutedToolCall(toolCall.getId(), toolCall.getName(), toolCall.getArguments(), toolResult,
                duration);
    }
}
