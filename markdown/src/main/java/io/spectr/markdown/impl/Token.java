package io.spectr.markdown.impl;

/**
 * A lexical token covering the byte range {@code [start, end)} of the source.
 *
 * @param kind token kind
 * @param start inclusive start offset
 * @param end exclusive end offset
 */
public record Token(TokenKind kind, int start, int end) {

    public int length() {
        return end - start;
    }

    @Override
    public String toString() {
        return kind + "[" + start + "," + end + ")";
    }
}
