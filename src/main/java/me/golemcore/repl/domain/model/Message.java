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
import java.util.List;
import java.util.Map;

/**
 * A single entry of the REPL conversation. Content is either plain text
 * ({@link #content}) or a structured sequence of text, tool-use and tool-result
 * blocks ({@link #blocks}).
 *
 * <p>
 * Assistant messages that request tools carry their text followed by one
 * {@link ContentBlock.Type#TOOL_USE} block per call; the matching
 * {@link ContentBlock.Type#TOOL_RESULT} blocks travel back in the next user
 * message, in the same order and with the same ids.
 */
@Data
@Builder
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";

    private String id;
    private String role; // user, assistant, system
    private String content;
    private List<ContentBlock> blocks;
    private Instant timestamp;

    public static Message system(String content) {
        return Message.builder()
                .role(ROLE_SYSTEM)
                .content(content)
                .timestamp(Instant.now())
                .build();
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    /**
     * Checks if this message carries structured content blocks instead of plain
     * text.
     */
    public boolean hasBlocks() {
        return blocks != null && !blocks.isEmpty();
    }

    public List<ContentBlock> getToolUseBlocks() {
        return blocksOfType(ContentBlock.Type.TOOL_USE);
    }

    public List<ContentBlock> getToolResultBlocks() {
        return blocksOfType(ContentBlock.Type.TOOL_RESULT);
    }

    private List<ContentBlock> blocksOfType(ContentBlock.Type type) {
        if (!hasBlocks()) {
            return List.of();
        }
        return blocks.stream()
                .filter(block -> block.getType() == type)
                .toList();
    }

    /**
     * A tool invocation requested by the LLM. Ids are unique within one provider
     * response and correlate the tool-use block with its tool-result block.
     */
    @Data
    @Builder
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }
}
