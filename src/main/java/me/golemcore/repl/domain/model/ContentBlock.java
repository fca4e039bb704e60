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

import java.util.Map;

/**
 * One element of a structured message: plain text, a tool-use request or a
 * tool result.
 */
@Data
@Builder
public class ContentBlock {

    private Type type;
    private String text; // text content, or tool result content
    private String toolUseId; // call id for TOOL_USE, referenced call id for TOOL_RESULT
    private String toolName;
    private Map<String, Object> input;
    private boolean error;

    public static ContentBlock text(String text) {
        return ContentBlock.builder()
                .type(Type.TEXT)
                .text(text)
                .build();
    }

    public static ContentBlock toolUse(Message.ToolCall toolCall) {
        return ContentBlock.builder()
                .type(Type.TOOL_USE)
                .toolUseId(toolCall.getId())
                .toolName(toolCall.getName())
                .input(toolCall.getArguments())
                .build();
    }

    public static ContentBlock toolResult(String toolUseId, String content, boolean error) {
        return ContentBlock.builder()
                .type(Type.TOOL_RESULT)
                .toolUseId(toolUseId)
                .text(content)
                .error(error)
                .build();
    }

    public enum Type {
        TEXT, TOOL_USE, TOOL_RESULT
    }
}
