package me.golemcore.repl.domain.input;

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

import me.golemcore.repl.domain.model.QueuedMessage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded FIFO of lines captured while the agent works. When full, enqueueing
 * drops the oldest entry, never the newest. Safe to share between the input
 * reader thread and the turn loop.
 */
public class MessageQueue {

    public static final int DEFAULT_MAX_SIZE = 50;

    private final int maxSize;
    private final Deque<QueuedMessage> messages = new ArrayDeque<>();

    public MessageQueue() {
        this(DEFAULT_MAX_SIZE);
    }

    public MessageQueue(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    public synchronized void enqueue(QueuedMessage message) {
        messages.addLast(message);
        while (messages.size() > maxSize) {
            messages.removeFirst();
        }
    }

    public synchronized Optional<QueuedMessage> dequeue() {
        return Optional.ofNullable(messages.pollFirst());
    }

    /**
     * Returns every queued message in arrival order and empties the queue in one
     * step.
     */
    public synchronized List<QueuedMessage> drain() {
        List<QueuedMessage> drained = new ArrayList<>(messages);
        messages.clear();
        return drained;
    }

    public synchronized Optional<QueuedMessage> peek() {
        return Optional.ofNullable(messages.peekFirst());
    }

    public synchronized int size() {
        return messages.size();
    }

    public synchronized boolean isEmpty() {
        return messages.isEmpty();
    }

    public synchronized void clear() {
        messages.clear();
    }

    public int getMaxSize() {
        return maxSize;
    }
}
