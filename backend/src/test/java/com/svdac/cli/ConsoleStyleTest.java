package com.svdac.cli;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleStyleTest {

    @Test
    void shouldEnableColoursForColourTerminals() {
        assertEquals(ConsoleStyle.ansi(), ConsoleStyle.fromEnvironment(Map.of("TERM", "xterm-256color")));
    }

    @Test
    void shouldStayPlainOtherwise() {
        assertEquals(ConsoleStyle.plain(), ConsoleStyle.fromEnvironment(Map.of("TERM", "dumb")));
        assertEquals(ConsoleStyle.plain(), ConsoleStyle.fromEnvironment(Map.of()));
    }
}
