package net.cadence.core.exec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ShellEscaperTest {

    @Test
    void escapesBacktickDollarAndDoubleQuote() {
        assertEquals("echo \\$HOME \\`id\\` \\\"x\\\"", ShellEscaper.escape("echo $HOME `id` \"x\""));
    }

    @Test
    void leavesEverythingElse() {
        assertEquals("ls -l /tmp | wc -l", ShellEscaper.escape("ls -l /tmp | wc -l"));
    }
}
