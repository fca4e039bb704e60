package me.golemcore.repl.domain.system.toolloop;

import me.golemcore.repl.domain.model.ContentBlock;
import me.golemcore.repl.domain.model.Message;
import me.golemcore.repl.domain.model.ReplSession;
import me.golemcore.repl.domain.model.ToolFailureKind;
import me.golemcore.repl.domain.model.ToolResult;
import me.golemcore.repl.domain.service.SessionService;
import me.golemcore.repl.domain.service.TrustedToolService;
import me.golemcore.repl.infrastructure.config.ReplProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DefaultHistoryWriterTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");

    private ReplSession session;
    private DefaultHistoryWriter writer;

    @BeforeEach
    void setUp() {
        TrustedToolService trustedToolService = mock(TrustedToolService.class);
        when(trustedToolService.loadTrustedTools(any())).thenReturn(new LinkedHashSet<>());
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        SessionService sessionService = new SessionService(trustedToolService, new ReplProperties(), clock);
        writer = new DefaultHistoryWriter(sessionService, clock);
        session = sessionService.createSession("/work/app");
    }

    @Test
    void appendsUserAndFinalAnswer() {
        writer.appendUserMessage(session, "hi");
        writer.appendFinalAssistantAnswer(session, null);

        List<Message> messages = session.getMessages();
        assertTrue(messages.get(0).isUserMessage());
        assertEquals("hi", messages.get(0).getContent());
        assertTrue(messages.get(1).isAssistantMessage());
        assertEquals("", messages.get(1).getContent());
        assertEquals(NOW, messages.get(1).getTimestamp());
    }

    @Test
    void toolExchangeWritesUseThenResults() {
        ToolExecutionOutcome ok = outcome("c1", ToolResult.success("listing"), "listing");
        ToolExecutionOutcome denied = ToolExecutionOutcome.synthetic(call("c2"), ToolFailureKind.CONFIRMATION_DENIED,
                "Tool execution was declined by the user");

        writer.appendToolExchange(session, "Looking around.", List.of(ok, denied), null);

        Message assistant = session.getMessages().get(0);
        Message results = session.getMessages().get(1);
        assertTrue(assistant.isAssistantMessage());
        assertEquals("Looking around.", assistant.getBlocks().get(0).getText());
        assertEquals(List.of("c1", "c2"),
                assistant.getToolUseBlocks().stream().map(ContentBlock::getToolUseId).toList());
        assertTrue(results.isUserMessage());
        List<ContentBlock> resultBlocks = results.getToolResultBlocks();
        assertFalse(resultBlocks.get(0).isError());
        assertEquals("listing", resultBlocks.get(0).getText());
        assertTrue(resultBlocks.get(1).isError());
    }

    @Test
    void trailingContextBecomesLastTextBlock() {
        writer.appendToolExchange(session, null, List.of(outcome("c1", ToolResult.success("x"), "x")),
                "\n\n---\nextra");

        List<ContentBlock> blocks = session.getMessages().get(1).getBlocks();
        assertEquals(2, blocks.size());
        assertEquals(ContentBlock.Type.TEXT, blocks.get(1).getType());
        assertEquals("\n\n---\nextra", blocks.get(1).getText());
        assertEquals(ContentBlock.Type.TOOL_USE, session.getMessages().get(0).getBlocks().get(0).getType());
    }

    @Test
    void emptyExchangeWritesNothing() {
        writer.appendToolExchange(session, "text", List.of(), "context");

        assertTrue(session.getMessages().isEmpty());
    }

    private static ToolExecutionOutcome outcome(String id, ToolResult result, String content) {
        return new ToolExecutionOutcome(call(id), result, content, Duration.ofMillis(5));
    }

    private static Message.ToolCall call(String id) {
        return Message.ToolCall.builder().id(id).name("bash_exec").arguments(Map.of("command", "ls")).build();
    }
}
