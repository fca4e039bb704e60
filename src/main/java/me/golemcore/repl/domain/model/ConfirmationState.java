package me.golemcore.repl.domain.model;

import lombok.Data;

/**
 * Confirmation state scoped to exactly one turn. A fresh instance is created at
 * turn start so "yes to all" never leaks into the next turn.
 */
@Data
public class ConfirmationState {

    private boolean allowAll;

    public static ConfirmationState forTurn() {
        return new ConfirmationState();
    }
}
