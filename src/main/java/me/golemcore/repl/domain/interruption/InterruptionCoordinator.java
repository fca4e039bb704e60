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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.repl.domain.input.MessageQueue;
import me.golemcore.repl.domain.model.ClassifiedInterruption;
import me.golemcore.repl.domain.model.InterruptionProcessingResult;
import me.golemcore.repl.domain.model.InterruptionType;
import me.golemcore.repl.domain.model.QueuedMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drains the capture queue, classifies what the user typed, and merges it into
 * one processing result.
 *
 * <p>
 * The turn loop calls {@link #pollAbort()} before each tool call and
 * {@link #collect()} at each iteration boundary. Messages drained by a poll
 * that found no abort are carried over to the next {@code collect()}, so their
 * context is injected once, in arrival order.
 */
@Slf4j
public class InterruptionCoordinator {

    private final MessageQueue queue;
    private final InterruptionClassifier classifier;
    private final InterruptionProcessor processor;
    private final List<QueuedMessage> carried = new ArrayList<>();

    public InterruptionCoordinator(MessageQueue queue, InterruptionClassifier classifier,
            InterruptionProcessor processor) {
        this.queue = queue;
        this.classifier = classifier;
        this.processor = processor;
    }

    /**
     * Returns the processed interruptions when an abort was typed since the last
     * call, otherwise empty. Non-abort messages stay pending for
     * {@link #collect()}.
     */
    public synchronized Optional<InterruptionProcessingResult> pollAbort() {
        carried.addAll(queue.drain());
        if (carried.isEmpty()) {
            return Optional.empty();
        }
        List<ClassifiedInterruption> classified = classifier.classifyAll(carried);
        if (classified.stream().noneMatch(c -> c.type() == InterruptionType.ABORT)) {
            return Optional.empty();
        }
        return Optional.of(processCarried(classified));
    }

    /**
     * Returns the processed interruptions, or empty when nothing was typed since
     * the last call.
     */
    public synchronized Optional<InterruptionProcessingResult> collect() {
        carried.addAll(queue.drain());
        if (carried.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(processCarried(classifier.classifyAll(carried)));
    }

    /**
     * Removes and returns messages drained by {@link #pollAbort()} that no
     * {@link #collect()} has consumed yet, oldest first.
     */
    public synchronized List<QueuedMessage> takeCarried() {
        List<QueuedMessage> pending = List.copyOf(carried);
        carried.clear();
        return pending;
    }

    /**
     * Classifies and processes messages that never reached the turn loop.
     */
    public InterruptionProcessingResult process(List<QueuedMessage> messages) {
        return processor.process(classifier.classifyAll(messages));
    }

    public String formatContext(InterruptionProcessingResult result) {
        return processor.formatContext(result);
    }

    private InterruptionProcessingResult processCarried(List<ClassifiedInterruption> classified) {
        int count = carried.size();
        carried.clear();
        InterruptionProcessingResult result = processor.process(classified);
        log.info("[Interrupt] {} message(s): {}", count, result.summary());
        return result;
    }
}
