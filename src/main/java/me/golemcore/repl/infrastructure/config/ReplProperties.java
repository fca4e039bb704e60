package me.golemcore.repl.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the REPL, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code repl.*} prefix:
 * <ul>
 * <li>{@link AgentProperties} - turn loop limits and system prompt</li>
 * <li>{@link ProviderProperties} - settings passed to the LLM adapter</li>
 * <li>{@link StorageProperties} - persistence root</li>
 * <li>{@link UiProperties} - conversation history bounds</li>
 * <li>{@link InputProperties} - concurrent input capture</li>
 * <li>{@link SecurityProperties} - tool confirmation and blocked commands</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "repl")
@Data
public class ReplProperties {

    private AgentProperties agent = new AgentProperties();
    private ProviderProperties provider = new ProviderProperties();
    private StorageProperties storage = new StorageProperties();
    private UiProperties ui = new UiProperties();
    private InputProperties input = new InputProperties();
    private SecurityProperties security = new SecurityProperties();

    @Data
    public static class AgentProperties {
        private int maxToolIterations = 25;
        private String systemPrompt = "You are a coding assistant working in the user's project. "
                + "Use the available tools to inspect and change files, run commands and manage git. "
                + "Explain what you are doing briefly.";
        private int toolTimeoutSeconds = 120;
    }

    @Data
    public static class ProviderProperties {
        private int maxTokens = 8192;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/repl";
    }

    @Data
    public static class UiProperties {
        private int maxHistorySize = 100;
    }

    @Data
    public static class InputProperties {
        private int maxQueueSize = 50;
        private boolean bell = false;
        private long animationIntervalMs = 80;
    }

    @Data
    public static class SecurityProperties {
        private ToolConfirmationProperties toolConfirmation = new ToolConfirmationProperties();
        private List<BlockedCommandProperties> blockedCommands = new ArrayList<>();
    }

    @Data
    public static class ToolConfirmationProperties {
        private boolean enabled = true;
        private List<String> tools = new ArrayList<>(List.of(
                "bash_exec", "bash_background", "write_file", "edit_file", "delete_file",
                "git_commit", "git_push", "git_checkout", "git_reset", "gh_pr_create"));
        private List<String> commandTools = new ArrayList<>(List.of("bash_exec", "bash_background", "shell"));
    }

    @Data
    public static class BlockedCommandProperties {
        private String pattern;
        private String category = "CUSTOM";
        private String rationale;
    }
}
