package me.golemcore.repl.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * The user declined the call at the confirmation prompt.
     */
    CONFIRMATION_DENIED,

    /**
     * Tool execution was denied by policy (unknown or disabled tool).
     */
    POLICY_DENIED,

    /**
     * Tool execution failed during runtime (exceptions, timeouts, non-zero exit,
     * etc.).
     */
    EXECUTION_FAILED
}
