package me.golemcore.repl.domain.system.toolloop;

import me.golemcore.repl.domain.model.AgentTurnResult;
import me.golemcore.repl.domain.model.ReplSession;
import me.golemcore.repl.port.outbound.LlmPort;
import me.golemcore.repl.port.outbound.ToolRegistryPort;

/**
 * Executes the LLM -> tools -> LLM loop of one agent turn.
 */
public interface ToolLoopSystem {

    /**
     * Appends {@code userMessage} to the session and runs the loop until the LLM
     * stops requesting tools, the turn is aborted, or the iteration limit is hit.
     *
     * <p>
     * Aborts are reported in the result, never thrown. A failing LLM call
     * propagates as a runtime exception and ends the turn.
     */
    AgentTurnResult executeTurn(ReplSession session, String userMessage, LlmPort llmPort,
            ToolRegistryPort toolRegistry, TurnOptions options);
}
