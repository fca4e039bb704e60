package me.golemcore.repl.domain.system.toolloop;

import me.golemcore.repl.domain.model.ReplSession;

import java.util.List;

/**
 * Single point of mutation for session history during a turn.
 *
 * <p>
 * ToolLoopSystem should not write messages directly.
 */
public interface HistoryWriter {

    void appendUserMessage(ReplSession session, String text);

    void appendFinalAssistantAnswer(ReplSession session, String finalText);

    /**
     * Appends one assistant message (text plus a tool-use block per outcome) and
     * one user message (the matching tool-result blocks, same order and ids).
     * Nothing is written when {@code outcomes} is empty.
     *
     * @param trailingContext
     *            optional text appended after the tool results, may be null
     */
    void appendToolExchange(ReplSession session, String assistantText, List<ToolExecutionOutcome> outcomes,
            String trailingContext);
}
