package me.golemcore.repl.domain.model;

/**
 * The single choice a human makes at a tool confirmation prompt.
 */
public enum ConfirmationDecision {
    NO, ABORT, YES, YES_ALL, TRUST_SESSION
}
