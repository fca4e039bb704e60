package me.golemcore.repl.domain.service;

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
import me.golemcore.repl.domain.model.Message;
import me.golemcore.repl.infrastructure.config.ReplProperties;
import me.golemcore.repl.security.CommandSafetyPolicy;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which tool calls need explicit user confirmation and describes them
 * for the prompt.
 *
 * <p>
 * Tools listed in {@code repl.security.tool-confirmation.tools} are gated. For
 * command tools (shell execution), risk mode lifts the gate for any command the
 * {@link CommandSafetyPolicy} does not block; blocked commands are always gated
 * and flagged in the description.
 */
@Component
@Slf4j
public class ToolConfirmationPolicy {

    private static final String COMMAND = "command";
    private static final String PATH = "path";
    private static final String UNKNOWN = "unknown";
    private static final int COMMAND_LENGTH_THRESHOLD = 80;

    private final boolean enabled;
    private final Set<String> confirmTools;
    private final Set<String> commandTools;
    private final RiskModeService riskModeService;
    private final CommandSafetyPolicy commandSafetyPolicy;

    public ToolConfirmationPolicy(ReplProperties properties, RiskModeService riskModeService,
            CommandSafetyPolicy commandSafetyPolicy) {
        ReplProperties.ToolConfirmationProperties config = properties.getSecurity().getToolConfirmation();
        this.enabled = config.isEnabled();
        this.confirmTools = new LinkedHashSet<>(config.getTools());
        this.commandTools = new LinkedHashSet<>(config.getCommandTools());
        this.riskModeService = riskModeService;
        this.commandSafetyPolicy = commandSafetyPolicy;
        log.info("[Confirm] ToolConfirmationPolicy enabled: {}, gated tools: {}", enabled, confirmTools);
    }

    /**
     * Check if a tool call requires user confirmation.
     */
    public boolean requiresConfirmation(Message.ToolCall toolCall) {
        if (!enabled || !confirmTools.contains(toolCall.getName())) {
            return false;
        }
        if (isCommandTool(toolCall.getName())) {
            String command = extractCommand(toolCall);
            return command == null || !riskModeService.shouldAutoApprove(command);
        }
        return true;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isCommandTool(String toolName) {
        return commandTools.contains(toolName);
    }

    /**
     * Build a human-readable description of the action for the confirmation prompt.
     */
    public String describeAction(Message.ToolCall toolCall) {
        String toolName = toolCall.getName();
        Map<String, Object> args = toolCall.getArguments();

        if (isCommandTool(toolName)) {
            return describeCommand(extractCommand(toolCall));
        }
        Object path = args != null ? args.get(PATH) : null;
        if (path != null) {
            return toolName + ": " + path;
        }
        return toolName + ": " + (args != null ? args : Map.of());
    }

    private String describeCommand(String command) {
        String shown = command != null ? command : UNKNOWN;
        if (shown.length() > COMMAND_LENGTH_THRESHOLD) {
            shown = shown.substring(0, COMMAND_LENGTH_THRESHOLD) + "...";
        }
        Optional<CommandSafetyRule> violation = commandSafetyPolicy.findViolation(command);
        if (violation.isPresent()) {
            return "Run command: " + shown + " [BLOCKED: " + violation.get().rationale() + "]";
        }
        return "Run command: " + shown;
    }

    private String extractCommand(Message.ToolCall toolCall) {
        Map<String, Object> args = toolCall.getArguments();
        Object command = args != null ? args.get(COMMAND) : null;
        return command != null ? command.toString() : null;
    }
}
