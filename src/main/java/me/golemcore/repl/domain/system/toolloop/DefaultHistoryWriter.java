package me.golemcore.repl.domain.system.toolloop;

import me.golemcore.repl.domain.model.ContentBlock;
import me.golemcore.repl.domain.model.Message;
import me.golemcore.repl.domain.model.ReplSession;
import me.golemcore.repl.domain.service.SessionService;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Default implementation that appends through {@link SessionService}, so
 * history bounds apply to every write.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    private final SessionService sessionService;
    private final Clock clock;

    public DefaultHistoryWriter(SessionService sessionService, Clock clock) {
        this.sessionService = sessionService;
        this.clock = clock;
    }

    @Override
    public void appendUserMessage(ReplSession session, String text) {
        sessionService.addMessage(session, message(Message.ROLE_USER, text, null));
    }

    @Override
    public void appendFinalAssistantAnswer(ReplSession session, String finalText) {
        sessionService.addMessage(session, message(Message.ROLE_ASSISTANT, finalText != null ? finalText : "", null));
    }

    @Override
    public void appendToolExchange(ReplSession session, String assistantText, List<ToolExecutionOutcome> outcomes,
            String trailingContext) {
        if (outcomes == null || outcomes.isEmpty()) {
            return;
        }

        List<ContentBlock> toolUses = new ArrayList<>();
        if (assistantText != null && !assistantText.isEmpty()) {
            toolUses.add(ContentBlock.text(assistantText));
        }
        List<ContentBlock> toolResults = new ArrayList<>();
        for (ToolExecutionOutcome outcome : outcomes) {
            toolUses.add(ContentBlock.toolUse(outcome.toolCall()));
            toolResults.add(ContentBlock.toolResult(outcome.toolCall().getId(), outcome.messageContent(),
                    !outcome.toolResult().isSuccess()));
        }
        if (trailingContext != null && !trailingContext.isBlank()) {
            toolResults.add(ContentBlock.text(trailingContext));
        }

        sessionService.addMessage(session, message(Message.ROLE_ASSISTANT, assistantText, toolUses));
        sessionService.addMessage(session, message(Message.ROLE_USER, null, toolResults));
    }

    private Message message(String role, String content, List<ContentBlock> blocks) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(role)
                .content(content)
                .blocks(blocks)
                .timestamp(clock.instant())
                .build();
    }
}
