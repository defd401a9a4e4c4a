package io.spectr.markdown.api;

import java.util.Arrays;

/**
 * Maps byte offsets to lines and columns and back.
 *
 * <p>Lines and columns are 1-based; columns count bytes. A line ends at {@code \n}; a
 * preceding {@code \r} belongs to the line terminator.
 */
public final class LineIndex {
    private final int[] lineStarts;
    private final byte[] src;

    private LineIndex(int[] lineStarts, byte[] src) {
        this.lineStarts = lineStarts;
        this.src = src;
    }

    public static LineIndex of(byte[] src) {
        int count = 1;
        for (byte b : src) {
            if (b == '\n') {
                count++;
            }
        }
        int[] starts = new int[count];
        int n = 1;
        for (int i = 0; i < src.length; i++) {
            if (src[i] == '\n') {
                starts[n++] = i + 1;
            }
        }
        return new LineIndex(starts, src);
    }

    /** A line/column pair. */
    public record Position(int line, int column) {
        @Override
        public String toString() {
            return line + ":" + column;
        }
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Returns the position of {@code offset}.
     *
     * @param offset a byte offset in {@code [0, length]}
     */
    public Position position(int offset) {
        int line = line(offset);
        return new Position(line, offset - lineStarts[line - 1] + 1);
    }

    /** Returns the 1-based line containing {@code offset}. */
    public int line(int offset) {
        if (offset < 0 || offset > src.length) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside [0, " + src.length + "]");
        }
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    /** Offset of the first byte of {@code line}. */
    public int lineStart(int line) {
        checkLine(line);
        return lineStarts[line - 1];
    }

    /** Offset just past the content of {@code line}, before its terminator. */
    public int lineEnd(int line) {
        checkLine(line);
        int end = line < lineStarts.length ? lineStarts[line] - 1 : src.length;
        if (line < lineStarts.length && end > lineStarts[line - 1] && src[end - 1] == '\r') {
            end--;
        }
        return end;
    }

    /**
     * Returns the offset of a 1-based line and column, clamped to the end of the line.
     */
    public int offset(int line, int column) {
        int start = lineStart(line);
        return Math.min(start + Math.max(column, 1) - 1, lineEnd(line));
    }

    private void checkLine(int line) {
        if (line < 1 || line > lineStarts.length) {
            throw new IndexOutOfBoundsException("line " + line + " outside [1, " + lineStarts.length + "]");
        }
    }
}
