package net.cadence.core.exec;

import java.util.ArrayList;
import java.util.List;

/**
 * POSIX shell-lexical splitting of a command line into an argument vector: whitespace separates
 * words, single quotes are literal, double quotes allow {@code \"} and {@code \\} escapes, and a
 * backslash outside quotes escapes the next character. Nothing is expanded.
 */
public final class ShellLexer {
    private ShellLexer() {}

    /**
     * @throws IllegalArgumentException on an unterminated quote or a trailing backslash
     */
    public static List<String> split(String line) {
        List<String> words = new ArrayList<>();
        if (line == null) return words;

        StringBuilder word = new StringBuilder();
        boolean inWord = false;
        char quote = 0;   // 0, '\'' or '"'
        int i = 0;
        int n = line.length();

        while (i < n) {
            char c = line.charAt(i);
            if (quote == '\'') {
                if (c == '\'') quote = 0; else word.append(c);
                i++;
            } else if (quote == '"') {
                if (c == '"') {
                    quote = 0;
                } else if (c == '\\' && i + 1 < n && (line.charAt(i + 1) == '"' || line.charAt(i + 1) == '\\')) {
                    word.append(line.charAt(++i));
                } else {
                    word.append(c);
                }
                i++;
            } else if (Character.isWhitespace(c)) {
                if (inWord) {
                    words.add(word.toString());
                    word.setLength(0);
                    inWord = false;
                }
                i++;
            } else if (c == '\'' || c == '"') {
                quote = c;
                inWord = true;
                i++;
            } else if (c == '\\') {
                if (i + 1 >= n) throw new IllegalArgumentException("No escaped character");
                word.append(line.charAt(i + 1));
                inWord = true;
                i += 2;
            } else {
                word.append(c);
                inWord = true;
                i++;
            }
        }
        if (quote != 0) throw new IllegalArgumentException("No closing quotation");
        if (inWord) words.add(word.toString());
        return words;
    }
}
