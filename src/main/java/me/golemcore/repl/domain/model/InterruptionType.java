package me.golemcore.repl.domain.model;

/**
 * Category assigned to text the user typed while a turn was in progress.
 */
public enum InterruptionType {

    ABORT,
    CORRECT,
    MODIFY,
    INFO
}
