package me.golemcore.repl.port.outbound;

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

import me.golemcore.repl.domain.model.ToolDefinition;
import me.golemcore.repl.domain.model.ToolResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Catalog and executor of the tools the LLM may call.
 */
public interface ToolRegistryPort {

    /**
     * Returns the schemas of all enabled tools, as sent to the LLM.
     */
    List<ToolDefinition> getToolDefinitionsForLlm();

    /**
     * Executes a tool by name. Implementations complete the future with a failed
     * {@link ToolResult} rather than exceptionally whenever they can.
     */
    CompletableFuture<ToolResult> execute(String toolName, Map<String, Object> arguments);
}
