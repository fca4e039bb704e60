package me.golemcore.repl.domain.system.toolloop;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag raised from outside the turn (e.g. Ctrl-C). The loop polls
 * it before every LLM call and every tool call.
 */
public class AbortSignal {

    private final AtomicBoolean aborted = new AtomicBoolean();

    public void abort() {
        aborted.set(true);
    }

    public boolean isAborted() {
        return aborted.get();
    }

    public void reset() {
        aborted.set(false);
    }
}
