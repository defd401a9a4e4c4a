package io.spectr.markdown.impl;

/**
 * Kinds of tokens emitted by {@link Lexer}.
 */
public enum TokenKind {
    /** Run of {@code #} opening an ATX header. */
    HEADING_MARKER,
    /** {@code -}, {@code *}, {@code +} or {@code 1.} / {@code 1)} list item marker. */
    LIST_MARKER,
    CHECKBOX_OPEN,
    /** The single state byte of a checkbox: space, {@code x} or {@code X}. */
    CHECKBOX_MARK,
    CHECKBOX_CLOSE,
    /** Dotted numeric task id such as {@code 1.2.3}. */
    TASK_ID,
    FENCE_OPEN,
    /** Info string following an opening fence. */
    FENCE_INFO,
    FENCE_CLOSE,
    /** One line of content inside a fenced code block, without its line terminator. */
    CODE_LINE,
    TEXT_RUN,
    /** Spaces and tabs at the start of a line or between block delimiters. */
    WHITESPACE,
    /** {@code \n} or {@code \r\n}. */
    NEWLINE,
    /** A line holding only spaces and tabs, including its line terminator. */
    BLANK_LINE,
    WIKILINK_OPEN,
    WIKILINK_CLOSE,
    BACKTICK_RUN,
    /** Run of {@code *} or {@code _}. */
    EMPHASIS_RUN
}
