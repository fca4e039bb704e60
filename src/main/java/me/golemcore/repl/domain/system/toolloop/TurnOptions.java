package me.golemcore.repl.domain.system.toolloop;

import lombok.Builder;
import lombok.Data;
import me.golemcore.repl.domain.interruption.InterruptionCoordinator;

/**
 * Per-turn knobs supplied by the caller.
 */
@Data
@Builder
public class TurnOptions {

    @Builder.Default
    private AgentTurnListener listener = AgentTurnListener.NOOP;

    @Builder.Default
    private AbortSignal abortSignal = new AbortSignal();

    /**
     * Approve every tool call without prompting (scripted use).
     */
    private boolean skipConfirmation;

    /**
     * When set, interruptions typed during the turn are merged at every
     * iteration boundary.
     */
    private InterruptionCoordinator interruptions;

    public static TurnOptions defaults() {
        return TurnOptions.builder().build();
    }
}
