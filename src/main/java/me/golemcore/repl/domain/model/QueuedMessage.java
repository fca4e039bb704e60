package me.golemcore.repl.domain.model;

import java.time.Instant;

/**
 * A line the user typed while the agent was working.
 */
public record QueuedMessage(String text, Instant timestamp) {
}
