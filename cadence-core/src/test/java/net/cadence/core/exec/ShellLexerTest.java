package net.cadence.core.exec;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShellLexerTest {

    @Test
    void quotesAndEscapes() {
        assertThat(ShellLexer.split("echo \"hello world\" 'a b' c\\ d \"x\\\"y\""))
                .containsExactly("echo", "hello world", "a b", "c d", "x\"y");
    }

    @Test
    void singleQuotesAreLiteral() {
        assertThat(ShellLexer.split("printf '%s\\n' $HOME")).containsExactly("printf", "%s\\n", "$HOME");
    }

    @Test
    void emptyQuotedWordIsKept() {
        assertThat(ShellLexer.split("a '' b")).isEqualTo(List.of("a", "", "b"));
    }

    @Test
    void trailingWhitespace() {
        assertThat(ShellLexer.split("ls -l ")).containsExactly("ls", "-l");
    }

    @Test
    void unterminatedQuote() {
        assertThatThrownBy(() -> ShellLexer.split("echo \"oops"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No closing quotation");
    }

    @Test
    void trailingBackslash() {
        assertThatThrownBy(() -> ShellLexer.split("echo \\"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No escaped character");
    }
}
