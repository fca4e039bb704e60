package me.golemcore.repl.domain.model;

import java.time.Instant;

/**
 * A captured message together with its category and a confidence in
 * {@code [0, 1]}.
 */
public record ClassifiedInterruption(String text, InterruptionType type, double confidence, Instant timestamp) {
}
