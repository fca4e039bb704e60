package me.golemcore.repl.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One interactive REPL session: the conversation history and the tools the
 * user has trusted for the lifetime of the session.
 *
 * <p>
 * The trusted set is ephemeral. It is seeded from the persisted trust record
 * when the session is created and grows when the user picks "trust for
 * session" at a confirmation prompt.
 */
@Data
@Builder
public class ReplSession {

    private String id;
    private String projectPath;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private Set<String> trustedTools = new LinkedHashSet<>();

    private Instant createdAt;
    private Instant updatedAt;

    public boolean isTrusted(String toolName) {
        return toolName != null && trustedTools.contains(toolName);
    }

    public void trust(String toolName) {
        trustedTools.add(toolName);
    }
}
