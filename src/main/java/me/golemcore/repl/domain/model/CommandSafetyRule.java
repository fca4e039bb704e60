package me.golemcore.repl.domain.model;

import java.util.regex.Pattern;

/**
 * One entry of the always-deny command table.
 */
public record CommandSafetyRule(Pattern pattern, Category category, String rationale) {

    public static CommandSafetyRule of(String regex, Category category, String rationale) {
        return new CommandSafetyRule(Pattern.compile(regex), category, rationale);
    }

    public boolean matches(String command) {
        return pattern.matcher(command).find();
    }

    public enum Category {
        FILESYSTEM_DESTRUCTION,
        RAW_DEVICE_WRITE,
        PARTITION_FORMAT,
        PIPE_TO_SHELL,
        CODE_INJECTION,
        PERMISSION_ESCALATION,
        SYSTEM_CONFIG_WRITE,
        FORK_BOMB,
        CUSTOM
    }
}
