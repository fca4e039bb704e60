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
import me.golemcore.repl.domain.model.Message;
import me.golemcore.repl.domain.model.ReplSession;
import me.golemcore.repl.infrastructure.config.ReplProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Creates REPL sessions and owns their message history.
 *
 * <p>
 * History is bounded: once it grows past twice {@code repl.ui.max-history-size}
 * messages, only the most recent {@code max-history-size} are kept. A trim
 * never leaves a tool-result message at the head of the history, since its
 * tool-use partner would be gone.
 */
@Service
@Slf4j
public class SessionService {

    private final TrustedToolService trustedToolService;
    private final ReplProperties properties;
    private final Clock clock;

    public SessionService(TrustedToolService trustedToolService, ReplProperties properties, Clock clock) {
        this.trustedToolService = trustedToolService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Starts a session for the given project, seeding its trusted set from the
     * persisted trust record.
     */
    public ReplSession createSession(String projectPath) {
        Instant now = clock.instant();
        ReplSession session = ReplSession.builder()
                .id(UUID.randomUUID().toString())
                .projectPath(projectPath)
                .createdAt(now)
                .updatedAt(now)
                .build();

        Set<String> trusted = trustedToolService.loadTrustedTools(projectPath);
        session.getTrustedTools().addAll(trusted);
        log.info("[Session] Created session {} for {} ({} trusted tools)", session.getId(), projectPath,
                trusted.size());
        return session;
    }

    public void addMessage(ReplSession session, Message message) {
        if (message.getTimestamp() == null) {
            message.setTimestamp(clock.instant());
        }
        session.getMessages().add(message);
        session.setUpdatedAt(clock.instant());
        trimHistory(session);
    }

    /**
     * The messages to send to the LLM: the system prompt followed by the
     * session history.
     */
    public List<Message> getConversationContext(ReplSession session) {
        List<Message> context = new ArrayList<>(session.getMessages().size() + 1);
        context.add(Message.system(properties.getAgent().getSystemPrompt()));
        context.addAll(session.getMessages());
        return context;
    }

    public void clear(ReplSession session) {
        session.getMessages().clear();
        session.setUpdatedAt(clock.instant());
    }

    private void trimHistory(ReplSession session) {
        int maxHistory = properties.getUi().getMaxHistorySize();
        List<Message> messages = session.getMessages();
        if (maxHistory <= 0 || messages.size() <= maxHistory * 2) {
            return;
        }

        List<Message> kept = new ArrayList<>(messages.subList(messages.size() - maxHistory, messages.size()));
        while (!kept.isEmpty() && !kept.get(0).getToolResultBlocks().isEmpty()) {
            kept.remove(0);
        }
        log.debug("[Session] Trimmed history of {} from {} to {} messages", session.getId(), messages.size(),
                kept.size());
        messages.clear();
        messages.addAll(kept);
    }
}
