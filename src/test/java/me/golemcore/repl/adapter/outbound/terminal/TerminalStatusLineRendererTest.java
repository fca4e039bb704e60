package me.golemcore.repl.adapter.outbound.terminal;

import org.jline.terminal.Terminal;
import org.jline.utils.InfoCmp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TerminalStatusLineRendererTest {

    private static final String ERASE = "\r\u001B[2K";

    private Terminal terminal;
    private StringWriter output;
    private TerminalStatusLineRenderer renderer;

    @BeforeEach
    void setUp() {
        terminal = mock(Terminal.class);
        output = new StringWriter();
        when(terminal.writer()).thenReturn(new PrintWriter(output));
        renderer = new TerminalStatusLineRenderer(terminal);
    }

    @Test
    void renderRedrawsLineInPlace() {
        renderer.render("working");
        renderer.render("working.");

        assertEquals(ERASE + "working" + ERASE + "working.", output.toString());
    }

    @Test
    void clearErasesRenderedLine() {
        renderer.render("status");
        renderer.clear();

        assertEquals(ERASE + "status" + ERASE, output.toString());
    }

    @Test
    void clearWithoutStatusWritesNothing() {
        renderer.clear();

        assertEquals("", output.toString());
    }

    @Test
    void printAboveRestoresStatusLine() {
        renderer.render("status");
        renderer.printAbove("→ bash_exec");

        assertEquals(ERASE + "status" + ERASE + "→ bash_exec" + System.lineSeparator() + ERASE + "status",
                output.toString());
    }

    @Test
    void printAboveWithoutStatusOnlyPrints() {
        renderer.printAbove("hello");

        assertEquals(ERASE + "hello" + System.lineSeparator(), output.toString());
    }

    @Test
    void longStatusKeepsItsTail() {
        when(terminal.getWidth()).thenReturn(10);

        renderer.render("0123456789abc");

        assertEquals(ERASE + "…56789abc", output.toString());
    }

    @Test
    void bellUsesTerminalCapability() {
        renderer.bell();

        verify(terminal).puts(InfoCmp.Capability.bell);
        verify(terminal).flush();
    }
}
