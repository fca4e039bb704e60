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

import me.golemcore.repl.domain.model.ConfirmationDecision;
import me.golemcore.repl.domain.model.Message;

import java.util.concurrent.CompletableFuture;

/**
 * Port for asking the human whether a tool call may run. The prompt offers
 * exactly the choices of {@link ConfirmationDecision}.
 */
public interface ConfirmationPort {

    /**
     * Asks the user about one tool call.
     *
     * @param toolCall
     *            the call awaiting a decision
     * @param description
     *            human-readable summary of what the call will do
     * @return the user's choice; never completes with {@code null}
     */
    CompletableFuture<ConfirmationDecision> requestConfirmation(Message.ToolCall toolCall, String description);

    /**
     * Whether a human is attached who can answer prompts.
     */
    boolean isAvailable();
}
