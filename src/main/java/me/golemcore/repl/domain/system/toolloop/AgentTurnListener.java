package me.golemcore.repl.domain.system.toolloop;

import me.golemcore.repl.domain.model.ExecutedToolCall;
import me.golemcore.repl.domain.model.InterruptionProcessingResult;
import me.golemcore.repl.domain.model.Message;

/**
 * Observer of turn progress. Events arrive in order on the thread running the
 * turn. All methods default to no-ops.
 */
public interface AgentTurnListener {

    AgentTurnListener NOOP = new AgentTurnListener() {
    };

    /**
     * Assistant text as soon as the LLM returns it.
     */
    default void onStream(String chunk) {
    }

    /**
     * The turn produced its last text.
     */
    default void onStreamDone() {
    }

    default void onThinkingStart() {
    }

    default void onThinkingEnd() {
    }

    /**
     * @param index
     *            zero-based position of the call in the LLM response
     * @param total
     *            number of calls in that response
     */
    default void onToolStart(Message.ToolCall toolCall, int index, int total) {
    }

    default void onToolEnd(ExecutedToolCall executedCall) {
    }

    default void onToolSkipped(Message.ToolCall toolCall, String reason) {
    }

    default void onInterruptionsProcessed(InterruptionProcessingResult result) {
    }
}
