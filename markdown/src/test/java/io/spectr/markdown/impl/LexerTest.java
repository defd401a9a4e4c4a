package io.spectr.markdown.impl;

import static io.spectr.markdown.impl.TokenKind.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class LexerTest {

    private static List<Token> tokens(String text) {
        return Lexer.tokenize(text.getBytes(StandardCharsets.UTF_8));
    }

    private static List<TokenKind> kinds(String text) {
        List<TokenKind> kinds = new ArrayList<>();
        for (Token t : tokens(text)) {
            kinds.add(t.kind());
        }
        return kinds;
    }

    private static String text(String src, Token t) {
        byte[] bytes = src.getBytes(StandardCharsets.UTF_8);
        return new String(bytes, t.start(), t.length(), StandardCharsets.UTF_8);
    }

    private static Token first(String src, TokenKind kind) {
        for (Token t : tokens(src)) {
            if (t.kind() == kind) {
                return t;
            }
        }
        throw new AssertionError("no " + kind + " in " + src);
    }

    @Test
    void taskLineWithId() {
        assertEquals(
            List.of(LIST_MARKER, WHITESPACE, CHECKBOX_OPEN, CHECKBOX_MARK, CHECKBOX_CLOSE, WHITESPACE,
                TASK_ID, WHITESPACE, TEXT_RUN, NEWLINE),
            kinds("- [ ] 1.2 Do it\n"));
        assertEquals("1.2", text("- [ ] 1.2 Do it\n", first("- [ ] 1.2 Do it\n", TASK_ID)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"-  [x]   3 Wide", "-\t[x]\t3 Tabs", "- [x]  3  Double", "-   [x] 3 Three"})
    void taskWhitespaceVariants(String line) {
        assertEquals(
            List.of(LIST_MARKER, WHITESPACE, CHECKBOX_OPEN, CHECKBOX_MARK, CHECKBOX_CLOSE, WHITESPACE,
                TASK_ID, WHITESPACE, TEXT_RUN),
            kinds(line));
        assertEquals("3", text(line, first(line, TASK_ID)));
    }

    @Test
    void checkboxDirectlyAfterMarker() {
        assertEquals(
            List.of(LIST_MARKER, CHECKBOX_OPEN, CHECKBOX_MARK, CHECKBOX_CLOSE, WHITESPACE, TEXT_RUN),
            kinds("-[ ] tight"));
    }

    @Test
    void numberedDescriptionIsNotAnId() {
        String line = "- [ ] 1. Foo";
        assertFalse(kinds(line).contains(TASK_ID));
        assertEquals("1. Foo", text(line, first(line, TEXT_RUN)));
    }

    @Test
    void idWithoutDescriptionIsText() {
        String line = "- [ ] 1.2";
        assertFalse(kinds(line).contains(TASK_ID));
        assertEquals("1.2", text(line, first(line, TEXT_RUN)));
    }

    @Test
    void crlfIsOneNewline() {
        List<Token> tokens = tokens("a\r\nb");
        assertEquals(List.of(TEXT_RUN, NEWLINE, TEXT_RUN), kinds("a\r\nb"));
        assertEquals(1, tokens.get(1).start());
        assertEquals(3, tokens.get(1).end());
    }

    @Test
    void blankLineIsSingleToken() {
        assertEquals(List.of(TEXT_RUN, NEWLINE, BLANK_LINE, TEXT_RUN), kinds("a\n  \t\nb"));
    }

    @Test
    void fencedBlockSuppressesBlockSyntax() {
        String src = "```java\n# not a header\n- [ ] not a task\n```\n";
        assertEquals(
            List.of(FENCE_OPEN, FENCE_INFO, NEWLINE, CODE_LINE, NEWLINE, CODE_LINE, NEWLINE, FENCE_CLOSE, NEWLINE),
            kinds(src));
        assertEquals("java", text(src, first(src, FENCE_INFO)));
    }

    @Test
    void shorterFenceDoesNotClose() {
        String src = "````\n```\n````\n";
        assertEquals(List.of(FENCE_OPEN, NEWLINE, CODE_LINE, NEWLINE, FENCE_CLOSE, NEWLINE), kinds(src));
    }

    @Test
    void headingNeedsSpace() {
        assertEquals(List.of(HEADING_MARKER, WHITESPACE, TEXT_RUN), kinds("## Title"));
        assertEquals(List.of(TEXT_RUN), kinds("#hashtag"));
    }

    @Test
    void orderedMarkers() {
        assertEquals(List.of(LIST_MARKER, WHITESPACE, TEXT_RUN), kinds("12. twelve"));
        assertEquals(List.of(LIST_MARKER, WHITESPACE, TEXT_RUN), kinds("3) three"));
        assertEquals(List.of(TEXT_RUN), kinds("1234567890. too long"));
    }

    @Test
    void inlineTokens() {
        assertEquals(
            List.of(TEXT_RUN, WIKILINK_OPEN, TEXT_RUN, WIKILINK_CLOSE, TEXT_RUN, EMPHASIS_RUN, TEXT_RUN,
                EMPHASIS_RUN, TEXT_RUN, BACKTICK_RUN, TEXT_RUN, BACKTICK_RUN),
            kinds("see [[spec]] and **b** `c`"));
    }

    @Test
    void escapedPunctuationStaysText() {
        assertEquals(List.of(TEXT_RUN), kinds("a \\*b\\* \\[\\[c"));
    }

    @Test
    void tokensCoverEveryByte() {
        String src = "# T\r\n\n- [x] 1 a *b* [[c|d]]\n  more\n```\nx\n```\n1. z\n";
        int expected = 0;
        for (Token t : tokens(src)) {
            assertEquals(expected, t.start(), "gap before " + t);
            assertTrue(t.end() > t.start(), "empty token " + t);
            expected = t.end();
        }
        assertEquals(src.getBytes(StandardCharsets.UTF_8).length, expected);
    }
}
