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
import me.golemcore.repl.domain.component.ToolComponent;
import me.golemcore.repl.domain.model.ToolDefinition;
import me.golemcore.repl.domain.model.ToolFailureKind;
import me.golemcore.repl.domain.model.ToolResult;
import me.golemcore.repl.infrastructure.config.ReplProperties;
import me.golemcore.repl.port.outbound.ToolRegistryPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registry of {@link ToolComponent} beans exposed to the LLM.
 *
 * <p>
 * Execution never completes exceptionally: unknown and disabled tools yield a
 * {@link ToolFailureKind#POLICY_DENIED} result, and exceptions or timeouts
 * inside a tool yield {@link ToolFailureKind#EXECUTION_FAILED}.
 */
@Service
@Slf4j
public class DefaultToolRegistry implements ToolRegistryPort {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();
    private final long timeoutSeconds;

    public DefaultToolRegistry(List<ToolComponent> toolComponents, ReplProperties properties) {
        this.timeoutSeconds = properties.getAgent().getToolTimeoutSeconds();
        for (ToolComponent tool : toolComponents) {
            register(tool);
        }
        log.info("[Tools] Registered {} tools: {}", tools.size(), tools.keySet());
    }

    public void register(ToolComponent tool) {
        tools.put(tool.getToolName(), tool);
    }

    @Override
    public List<ToolDefinition> getToolDefinitionsForLlm() {
        return tools.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public CompletableFuture<ToolResult> execute(String toolName, Map<String, Object> arguments) {
        String name = sanitizeToolName(toolName);
        ToolComponent tool = name != null ? tools.get(name) : null;
        if (tool == null) {
            String available = String.join(", ", tools.keySet());
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                    "Unknown tool: " + name + ". Available tools: " + available));
        }
        if (!tool.isEnabled()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Tool is disabled: " + name));
        }

        CompletableFuture<ToolResult> future;
        try {
            future = tool.execute(arguments != null ? arguments : Map.of());
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future
                .orTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .exceptionally(error -> {
                    log.error("[Tools] Tool execution failed: {}", name, error);
                    return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                            "Tool execution failed: " + safeCauseMessage(error));
                });
    }

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        if (cursor instanceof TimeoutException) {
            return "timed out";
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strip special tokens some models leak into tool call names, such as
     * {@code <|channel|>}.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }
}
