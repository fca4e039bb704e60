package me.golemcore.repl.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.repl.domain.model.CommandSafetyRule;
import me.golemcore.repl.domain.model.CommandSafetyRule.Category;
import me.golemcore.repl.infrastructure.config.ReplProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;

/**
 * Always-deny table for shell commands.
 *
 * <p>
 * A command matching any rule is never auto-approved, whatever the risk mode or
 * trust settings say about auto-approval. The built-in rules cover:
 * <ul>
 * <li>Filesystem destruction of the root or home directory</li>
 * <li>Raw device writes and partition formatting</li>
 * <li>Pipe-to-shell downloads</li>
 * <li>Command substitution and eval</li>
 * <li>World-writable and root-ownership changes</li>
 * <li>Writes into system configuration directories</li>
 * <li>Fork bombs</li>
 * </ul>
 * Extra rules can be appended with {@code repl.security.blocked-commands}; they
 * extend the table and can never remove a built-in rule.
 *
 * <p>
 * The component holds no mutable state and is thread-safe.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class CommandSafetyPolicy {

    static final List<CommandSafetyRule> BUILT_IN_RULES = List.of(
            CommandSafetyRule.of("\\brm\\s+-rf\\s+/(?!\\w)", Category.FILESYSTEM_DESTRUCTION,
                    "Recursive delete of the filesystem root"),
            CommandSafetyRule.of("\\brm\\s+-rf\\s+(~|\\$HOME)/?(\\s|$|\\*)", Category.FILESYSTEM_DESTRUCTION,
                    "Recursive delete of the home directory"),
            CommandSafetyRule.of("\\bsudo\\s+rm\\s+-rf", Category.FILESYSTEM_DESTRUCTION,
                    "Recursive delete with root privileges"),
            CommandSafetyRule.of("\\bdd\\s+if=.*of=/dev/", Category.RAW_DEVICE_WRITE,
                    "dd writing straight to a device"),
            CommandSafetyRule.of(">\\s*/dev/(sd|nvme|hd|disk)", Category.RAW_DEVICE_WRITE,
                    "Redirect into a block device"),
            CommandSafetyRule.of("\\bmkfs\\.", Category.PARTITION_FORMAT,
                    "Formats a partition"),
            CommandSafetyRule.of("\\bcurl\\s+.*\\|\\s*(ba)?sh", Category.PIPE_TO_SHELL,
                    "Downloaded script executed without review"),
            CommandSafetyRule.of("\\bwget\\s+.*\\|\\s*(ba)?sh", Category.PIPE_TO_SHELL,
                    "Downloaded script executed without review"),
            CommandSafetyRule.of("`[^`]*`", Category.CODE_INJECTION,
                    "Backtick command substitution"),
            CommandSafetyRule.of("\\$\\(", Category.CODE_INJECTION,
                    "Command substitution"),
            CommandSafetyRule.of("\\beval\\s+", Category.CODE_INJECTION,
                    "eval of dynamic code"),
            CommandSafetyRule.of("\\bchmod\\s+(-R\\s+)?777", Category.PERMISSION_ESCALATION,
                    "Makes files world-writable"),
            CommandSafetyRule.of("\\bchown\\s+(-R\\s+)?root", Category.PERMISSION_ESCALATION,
                    "Hands ownership to root"),
            CommandSafetyRule.of(">\\s*/etc/", Category.SYSTEM_CONFIG_WRITE,
                    "Overwrites system configuration"),
            CommandSafetyRule.of(">\\s*/root/", Category.SYSTEM_CONFIG_WRITE,
                    "Writes into the root user's home"),
            CommandSafetyRule.of(":\\s*\\(\\s*\\)\\s*\\{", Category.FORK_BOMB,
                    "Fork bomb"));

    private final List<CommandSafetyRule> rules;

    public CommandSafetyPolicy(ReplProperties properties) {
        this(properties.getSecurity().getBlockedCommands());
    }

    // Visible for testing
    CommandSafetyPolicy(List<ReplProperties.BlockedCommandProperties> configuredRules) {
        List<CommandSafetyRule> all = new ArrayList<>(BUILT_IN_RULES);
        if (configuredRules != null) {
            for (ReplProperties.BlockedCommandProperties configured : configuredRules) {
                toRule(configured).ifPresent(all::add);
            }
        }
        this.rules = Collections.unmodifiableList(all);
        log.debug("[Security] Command safety policy loaded: {} rules ({} configured)", rules.size(),
                rules.size() - BUILT_IN_RULES.size());
    }

    /**
     * Returns true if the command matches any always-deny rule. Null and blank
     * commands are never blocked.
     */
    public boolean isBlocked(String command) {
        return findViolation(command).isPresent();
    }

    /**
     * Returns the first rule the command violates, in table order.
     */
    public Optional<CommandSafetyRule> findViolation(String command) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }
        for (CommandSafetyRule rule : rules) {
            if (rule.matches(command)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public List<CommandSafetyRule> getRules() {
        return rules;
    }

    private Optional<CommandSafetyRule> toRule(ReplProperties.BlockedCommandProperties configured) {
        if (configured.getPattern() == null || configured.getPattern().isBlank()) {
            log.warn("[Security] Skipping blocked command rule without pattern");
            return Optional.empty();
        }
        Category category = parseCategory(configured.getCategory());
        String rationale = configured.getRationale() != null ? configured.getRationale() : "Configured rule";
        try {
            return Optional.of(CommandSafetyRule.of(configured.getPattern(), category, rationale));
        } catch (PatternSyntaxException e) {
            throw new IllegalStateException("Invalid blocked command pattern: " + configured.getPattern(), e);
        }
    }

    private Category parseCategory(String value) {
        if (value == null || value.isBlank()) {
            return Category.CUSTOM;
        }
        try {
            return Category.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("[Security] Unknown blocked command category '{}', using CUSTOM", value);
            return Category.CUSTOM;
        }
    }
}
