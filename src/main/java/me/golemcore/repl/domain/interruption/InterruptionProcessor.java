package me.golemcore.repl.domain.interruption;

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

import me.golemcore.repl.domain.model.ClassifiedInterruption;
import me.golemcore.repl.domain.model.InterruptionProcessingResult;
import me.golemcore.repl.domain.model.InterruptionType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges classified interruptions into an abort decision and context blocks.
 *
 * <p>
 * Non-abort interruptions are grouped into up to three numbered blocks, in this
 * order: corrections (high priority), modifications, additional context. The
 * blocks are built even when an abort is present.
 */
@Component
public class InterruptionProcessor {

    static final String CORRECTIONS_HEADER = "**Corrections from user (high priority):**";
    static final String MODIFICATIONS_HEADER = "**Modifications requested by user:**";
    static final String INFO_HEADER = "**Additional context from user:**";

    private static final String CONTEXT_HEADER = "\n\n---\n## User provided additional instructions while you were working:\n\n";
    private static final String CONTEXT_FOOTER = "\n\nPlease incorporate this feedback into your current work.\n";

    public InterruptionProcessingResult process(List<ClassifiedInterruption> interruptions) {
        if (interruptions == null || interruptions.isEmpty()) {
            return new InterruptionProcessingResult(false, List.of(), "No interruptions to process");
        }

        boolean shouldAbort = interruptions.stream().anyMatch(i -> i.type() == InterruptionType.ABORT);
        List<String> contextMessages = new ArrayList<>();
        List<String> summaryParts = new ArrayList<>();
        if (shouldAbort) {
            summaryParts.add("Abort requested by user");
        }

        addGroup(interruptions, InterruptionType.CORRECT, CORRECTIONS_HEADER, "correction(s)", contextMessages,
                summaryParts);
        addGroup(interruptions, InterruptionType.MODIFY, MODIFICATIONS_HEADER, "modification(s)", contextMessages,
                summaryParts);
        addGroup(interruptions, InterruptionType.INFO, INFO_HEADER, "info message(s)", contextMessages,
                summaryParts);

        String summary = summaryParts.isEmpty() ? "No actionable interruptions" : String.join(", ", summaryParts);
        return new InterruptionProcessingResult(shouldAbort, List.copyOf(contextMessages), summary);
    }

    /**
     * Renders the context blocks as one text block to inject into the
     * conversation. Empty when there is nothing to inject.
     */
    public String formatContext(InterruptionProcessingResult result) {
        if (result == null || !result.hasContext()) {
            return "";
        }
        return CONTEXT_HEADER + String.join("\n\n", result.contextMessages()) + CONTEXT_FOOTER;
    }

    private static void addGroup(List<ClassifiedInterruption> interruptions, InterruptionType type, String header,
            String noun, List<String> contextMessages, List<String> summaryParts) {
        List<ClassifiedInterruption> group = interruptions.stream()
                .filter(i -> i.type() == type)
                .toList();
        if (group.isEmpty()) {
            return;
        }

        StringBuilder block = new StringBuilder(header);
        for (int i = 0; i < group.size(); i++) {
            block.append('\n').append(i + 1).append(". ").append(group.get(i).text());
        }
        contextMessages.add(block.toString());
        summaryParts.add(group.size() + " " + noun);
    }
}
