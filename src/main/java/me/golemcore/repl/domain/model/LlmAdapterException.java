package me.golemcore.repl.domain.model;

/**
 * Raised by LLM adapters when a provider call fails. The turn loop never
 * retries it.
 */
public class LlmAdapterException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LlmAdapterException(String message) {
        super(message);
    }

    public LlmAdapterException(String message, Throwable cause) {
        super(message, cause);
    }
}
