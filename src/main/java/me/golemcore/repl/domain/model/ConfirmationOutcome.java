package me.golemcore.repl.domain.model;

/**
 * Terminal state of the confirmation gate for one tool call.
 */
public enum ConfirmationOutcome {

    /**
     * No prompt was needed (skip flag, allow-all, trusted, or not a gated tool).
     */
    AUTO_APPROVED(true),
    APPROVED(true),
    APPROVED_ALL_FOR_TURN(true),
    TRUSTED_FOR_SESSION(true),
    DECLINED(false),
    ABORTED(false);

    private final boolean approved;

    ConfirmationOutcome(boolean approved) {
        this.approved = approved;
    }

    public boolean isApproved() {
        return approved;
    }
}
