package me.golemcore.repl.port.outbound;

/**
 * Fixed-position status line shown while the agent is working.
 */
public interface StatusLinePort {

    /**
     * Replaces the status line with {@code text}.
     */
    void render(String text);

    /**
     * Removes the status line, if one is shown.
     */
    void clear();

    void bell();
}
