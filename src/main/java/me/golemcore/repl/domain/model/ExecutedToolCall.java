package me.golemcore.repl.domain.model;

import java.time.Duration;
import java.util.Map;

/**
 * A tool call as it was resolved during a turn: executed, failed, or declined.
 * Never mutated after creation.
 */
public record ExecutedToolCall(String id, String name, Map<String, Object> arguments, ToolResult result,
        Duration duration) {

    public boolean isSuccess() {
        return result != null && result.isSuccess();
    }
}
