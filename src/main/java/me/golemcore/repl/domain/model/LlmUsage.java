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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token counts reported by the LLM adapter for one call, or accumulated over a
 * whole turn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmUsage {

    private int inputTokens;
    private int outputTokens;

    public static LlmUsage of(int inputTokens, int outputTokens) {
        return LlmUsage.builder()
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .build();
    }

    public static LlmUsage empty() {
        return of(0, 0);
    }

    /**
     * Returns a new usage record summing this one and {@code other}. A null
     * {@code other} counts as zero.
     */
    public LlmUsage plus(LlmUsage other) {
        if (other == null) {
            return of(inputTokens, outputTokens);
        }
        return of(inputTokens + other.getInputTokens(), outputTokens + other.getOutputTokens());
    }

    public int getTotalTokens() {
        return inputTokens + outputTokens;
    }
}
