package me.golemcore.repl.domain.model;

import java.util.List;

/**
 * Result of merging a batch of interruptions. Context blocks are produced even
 * when {@code shouldAbort} is set, so the caller may still surface them.
 */
public record InterruptionProcessingResult(boolean shouldAbort, List<String> contextMessages, String summary) {

    public boolean hasContext() {
        return contextMessages != null && !contextMessages.isEmpty();
    }
}
