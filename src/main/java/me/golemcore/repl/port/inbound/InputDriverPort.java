package me.golemcore.repl.port.inbound;

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

import java.util.function.Consumer;

/**
 * Source of raw input units (one or more characters per call) for concurrent
 * input capture. The real implementation reads the terminal in raw mode; tests
 * push synthetic keystrokes.
 */
public interface InputDriverPort {

    /**
     * Starts delivering input to {@code listener}. Calling start on a running
     * driver replaces nothing and is ignored.
     */
    void start(Consumer<String> listener);

    /**
     * Stops delivering input and releases the underlying source.
     */
    void stop();

    boolean isRunning();
}
