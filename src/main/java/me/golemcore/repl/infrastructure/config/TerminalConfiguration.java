package me.golemcore.repl.infrastructure.config;

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

import me.golemcore.repl.adapter.inbound.terminal.JLineInputDriver;
import me.golemcore.repl.adapter.outbound.terminal.TerminalConfirmationAdapter;
import me.golemcore.repl.adapter.outbound.terminal.TerminalStatusLineRenderer;
import me.golemcore.repl.domain.input.ConcurrentInputCapture;
import me.golemcore.repl.domain.input.MessageQueue;
import me.golemcore.repl.port.inbound.InputDriverPort;
import me.golemcore.repl.port.outbound.ConfirmationPort;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * JLine terminal and the adapters built on it.
 */
@Configuration
public class TerminalConfiguration {

    @Bean(destroyMethod = "close")
    public Terminal terminal() {
        try {
            return TerminalBuilder.builder()
                    .name("golemcore-repl")
                    .system(true)
                    .build();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open terminal", e);
        }
    }

    @Bean
    public LineReader lineReader(Terminal terminal, ReplProperties properties) {
        return LineReaderBuilder.builder()
                .terminal(terminal)
                .variable(LineReader.HISTORY_SIZE, properties.getUi().getMaxHistorySize())
                .build();
    }

    @Bean
    public TerminalStatusLineRenderer terminalStatusLineRenderer(Terminal terminal) {
        return new TerminalStatusLineRenderer(terminal);
    }

    @Bean
    public InputDriverPort terminalInputDriver(Terminal terminal) {
        return new JLineInputDriver(terminal);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService captureScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "capture-animation");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ConcurrentInputCapture concurrentInputCapture(InputDriverPort terminalInputDriver,
            TerminalStatusLineRenderer terminalStatusLineRenderer, MessageQueue interruptionQueue,
            ScheduledExecutorService captureScheduler, ReplProperties properties, Clock clock) {
        ReplProperties.InputProperties input = properties.getInput();
        return new ConcurrentInputCapture(terminalInputDriver, terminalStatusLineRenderer, interruptionQueue,
                captureScheduler, input.isBell(), input.getAnimationIntervalMs(), clock);
    }

    @Bean
    public ConfirmationPort terminalConfirmationPort(LineReader lineReader, ConcurrentInputCapture inputCapture) {
        return new TerminalConfirmationAdapter(lineReader, inputCapture);
    }
}
