package me.golemcore.repl.domain.service;

import me.golemcore.repl.domain.model.ContentBlock;
import me.golemcore.repl.domain.model.Message;
import me.golemcore.repl.domain.model.ReplSession;
import me.golemcore.repl.infrastructure.config.ReplProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionServiceTest {

    private static final String PROJECT = "/work/app";
    private static final Instant NOW = Instant.parse("2026-05-05T08:00:00Z");

    private TrustedToolService trustedToolService;
    private ReplProperties properties;
    private SessionService service;

    @BeforeEach
    void setUp() {
        trustedToolService = mock(TrustedToolService.class);
        when(trustedToolService.loadTrustedTools(PROJECT)).thenReturn(new LinkedHashSet<>(Set.of("read_file")));
        properties = new ReplProperties();
        properties.getUi().setMaxHistorySize(3);
        properties.getAgent().setSystemPrompt("You are helpful.");
        service = new SessionService(trustedToolService, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createSessionSeedsPersistedTrust() {
        ReplSession session = service.createSession(PROJECT);

        assertNotNull(session.getId());
        assertEquals(PROJECT, session.getProjectPath());
        assertEquals(NOW, session.getCreatedAt());
        assertTrue(session.isTrusted("read_file"));
        assertTrue(session.getMessages().isEmpty());
    }

    @Test
    void sessionsHaveDistinctIds() {
        assertNotEquals(service.createSession(PROJECT).getId(), service.createSession(PROJECT).getId());
    }

    @Test
    void addMessageStampsMissingTimestamp() {
        ReplSession session = service.createSession(PROJECT);
        Message message = Message.builder().role(Message.ROLE_USER).content("hi").build();

        service.addMessage(session, message);

        assertEquals(NOW, message.getTimestamp());
    }

    @Test
    void addMessageStampsSessionWithClock() {
        ReplSession session = service.createSession(PROJECT);
        session.setUpdatedAt(null);

        service.addMessage(session, userMessage("hello"));

        assertEquals(NOW, session.getUpdatedAt());
    }

    @Test
    void contextStartsWithSystemPrompt() {
        ReplSession session = service.createSession(PROJECT);
        service.addMessage(session, userMessage("hello"));

        List<Message> context = service.getConversationContext(session);

        assertEquals(2, context.size());
        assertTrue(context.get(0).isSystemMessage());
        assertEquals("You are helpful.", context.get(0).getContent());
        assertEquals("hello", context.get(1).getContent());
    }

    // ==================== Trimming ====================

    @Test
    void keepsUpToTwiceMaxHistory() {
        ReplSession session = service.createSession(PROJECT);
        for (int i = 0; i < 6; i++) {
            service.addMessage(session, userMessage("m" + i));
        }

        assertEquals(6, session.getMessages().size());
    }

    @Test
    void trimsToMaxHistoryWhenExceeded() {
        ReplSession session = service.createSession(PROJECT);
        for (int i = 0; i < 7; i++) {
            service.addMessage(session, userMessage("m" + i));
        }

        assertEquals(List.of("m4", "m5", "m6"), session.getMessages().stream().map(Message::getContent).toList());
    }

    @Test
    void trimmingNeverStartsWithOrphanedToolResult() {
        ReplSession session = service.createSession(PROJECT);
        for (int i = 0; i < 3; i++) {
            service.addMessage(session, userMessage("m" + i));
        }
        service.addMessage(session, Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .blocks(List.of(ContentBlock.toolUse(Message.ToolCall.builder().id("c1").name("ls").build())))
                .build());
        service.addMessage(session, Message.builder()
                .role(Message.ROLE_USER)
                .blocks(List.of(ContentBlock.toolResult("c1", "ok", false)))
                .build());
        service.addMessage(session, assistantMessage("a"));
        service.addMessage(session, userMessage("b"));

        assertEquals(List.of("a", "b"), session.getMessages().stream().map(Message::getContent).toList());
    }

    @Test
    void clearRemovesHistory() {
        ReplSession session = service.createSession(PROJECT);
        service.addMessage(session, userMessage("hello"));

        service.clear(session);

        assertTrue(session.getMessages().isEmpty());
    }

    private static Message userMessage(String text) {
        return Message.builder().role(Message.ROLE_USER).content(text).build();
    }

    private static Message assistantMessage(String text) {
        return Message.builder().role(Message.ROLE_ASSISTANT).content(text).build();
    }
}
