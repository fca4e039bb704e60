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
import me.golemcore.repl.domain.model.ConfirmationDecision;
import me.golemcore.repl.domain.model.ConfirmationOutcome;
import me.golemcore.repl.domain.model.ConfirmationState;
import me.golemcore.repl.domain.model.Message;
import me.golemcore.repl.domain.model.ReplSession;
import me.golemcore.repl.port.outbound.ConfirmationPort;
import org.springframework.stereotype.Service;

/**
 * Per-call confirmation decision.
 *
 * <p>
 * A call is approved silently when confirmation is skipped for the turn, when
 * the user already chose "yes to all" in this turn, when the tool is trusted in
 * the session, or when {@link ToolConfirmationPolicy} does not gate it.
 * Otherwise the user is asked once and the answer maps to a terminal outcome:
 * <ul>
 * <li>{@code NO} - decline this call only</li>
 * <li>{@code ABORT} - abort the whole turn</li>
 * <li>{@code YES} - approve this call only</li>
 * <li>{@code YES_ALL} - approve every remaining call of the turn</li>
 * <li>{@code TRUST_SESSION} - trust the tool for the session and persist that
 * trust for the project in the background</li>
 * </ul>
 * If no human can be asked, or the prompt fails, the call is declined.
 */
@Service
@Slf4j
public class ToolConfirmationGate {

    private final ToolConfirmationPolicy confirmationPolicy;
    private final ConfirmationPort confirmationPort;
    private final TrustedToolService trustedToolService;

    public ToolConfirmationGate(ToolConfirmationPolicy confirmationPolicy, ConfirmationPort confirmationPort,
            TrustedToolService trustedToolService) {
        this.confirmationPolicy = confirmationPolicy;
        this.confirmationPort = confirmationPort;
        this.trustedToolService = trustedToolService;
    }

    public ConfirmationOutcome evaluate(ReplSession session, Message.ToolCall toolCall, ConfirmationState state,
            boolean skipConfirmation) {
        String toolName = toolCall.getName();
        if (skipConfirmation || state.isAllowAll() || session.isTrusted(toolName)
                || !confirmationPolicy.requiresConfirmation(toolCall)) {
            return ConfirmationOutcome.AUTO_APPROVED;
        }

        if (!confirmationPort.isAvailable()) {
            log.warn("[Confirm] No confirmation prompt available, declining '{}'", toolName);
            return ConfirmationOutcome.DECLINED;
        }

        ConfirmationDecision decision = ask(toolCall);
        return switch (decision) {
        case NO -> ConfirmationOutcome.DECLINED;
        case ABORT -> ConfirmationOutcome.ABORTED;
        case YES -> ConfirmationOutcome.APPROVED;
        case YES_ALL -> {
            state.setAllowAll(true);
            yield ConfirmationOutcome.APPROVED_ALL_FOR_TURN;
        }
        case TRUST_SESSION -> {
            trustForSession(session, toolName);
            yield ConfirmationOutcome.TRUSTED_FOR_SESSION;
        }
        };
    }

    private ConfirmationDecision ask(Message.ToolCall toolCall) {
        String description = confirmationPolicy.describeAction(toolCall);
        log.info("[Confirm] Requesting confirmation for '{}': {}", toolCall.getName(), description);
        try {
            ConfirmationDecision decision = confirmationPort.requestConfirmation(toolCall, description).join();
            log.info("[Confirm] '{}' -> {}", toolCall.getName(), decision);
            return decision != null ? decision : ConfirmationDecision.NO;
        } catch (RuntimeException e) {
            log.error("[Confirm] Confirmation request failed, denying", e);
            return ConfirmationDecision.NO;
        }
    }

    private void trustForSession(ReplSession session, String toolName) {
        session.trust(toolName);
        try {
            trustedToolService.saveTrustedTool(toolName, session.getProjectPath(), false)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            log.warn("[Trust] Failed to persist trust for '{}': {}", toolName,
                                    error.getMessage());
                        } else {
                            log.debug("[Trust] Persisted trust for '{}' in {}", toolName,
                                    session.getProjectPath());
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("[Trust] Failed to schedule trust persistence for '{}'", toolName, e);
        }
    }
}
