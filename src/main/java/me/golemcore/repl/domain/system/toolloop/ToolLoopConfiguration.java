package me.golemcore.repl.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.repl.domain.interruption.InterruptionClassifier;
import me.golemcore.repl.domain.interruption.InterruptionCoordinator;
import me.golemcore.repl.domain.interruption.InterruptionProcessor;
import me.golemcore.repl.domain.input.MessageQueue;
import me.golemcore.repl.domain.service.SessionService;
import me.golemcore.repl.domain.service.ToolConfirmationGate;
import me.golemcore.repl.infrastructure.config.ReplProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ToolLoopConfiguration {

    @Bean
    public HistoryWriter toolLoopHistoryWriter(SessionService sessionService, Clock clock) {
        return new DefaultHistoryWriter(sessionService, clock);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(SessionService sessionService, HistoryWriter historyWriter,
            ToolConfirmationGate confirmationGate, ReplProperties properties, ObjectMapper objectMapper,
            Clock clock) {
        return new DefaultToolLoopSystem(sessionService, historyWriter, confirmationGate, properties, objectMapper,
                clock);
    }

    @Bean
    public MessageQueue interruptionQueue(ReplProperties properties) {
        return new MessageQueue(properties.getInput().getMaxQueueSize());
    }

    @Bean
    public InterruptionCoordinator interruptionCoordinator(MessageQueue interruptionQueue,
            InterruptionClassifier classifier, InterruptionProcessor processor) {
        return new InterruptionCoordinator(interruptionQueue, classifier, processor);
    }
}
