package me.golemcore.repl.domain.input;

/**
 * Lifecycle of {@link ConcurrentInputCapture}.
 */
public enum CaptureState {
    IDLE, CAPTURING, STOPPED
}
