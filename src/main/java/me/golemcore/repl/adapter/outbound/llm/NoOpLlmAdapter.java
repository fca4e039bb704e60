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

package me.golemcore.repl.adapter.outbound.llm;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.repl.domain.model.LlmRequest;
import me.golemcore.repl.domain.model.LlmResponse;
import me.golemcore.repl.domain.model.LlmUsage;
import me.golemcore.repl.port.outbound.LlmPort;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * No-op LLM adapter used when no real provider is wired in.
 *
 * <p>
 * Always answers with a placeholder text and no tool calls, so every turn
 * completes after one iteration.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Slf4j
public class NoOpLlmAdapter implements LlmPort {

    static final String PLACEHOLDER = "[No LLM configured]";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chatWithTools(LlmRequest request) {
        log.warn("[LLM] chatWithTools() called - no LLM configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content(PLACEHOLDER)
                .toolCalls(List.of())
                .usage(LlmUsage.empty())
                .build());
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
