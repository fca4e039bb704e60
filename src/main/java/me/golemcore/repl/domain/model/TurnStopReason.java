package me.golemcore.repl.domain.model;

/**
 * Why an agent turn ended.
 */
public enum TurnStopReason {

    /**
     * The LLM answered without requesting tools.
     */
    COMPLETED,

    /**
     * The iteration limit was reached while the LLM was still requesting tools.
     * The task may be incomplete.
     */
    MAX_ITERATIONS,

    /**
     * The user cancelled the turn, declined with abort, or sent an abort
     * interruption.
     */
    ABORTED
}
