package io.spectr.markdown.api;

/**
 * Half-open byte range {@code [start, end)} over the UTF-8 encoding of a document.
 *
 * @param start inclusive start offset
 * @param end exclusive end offset
 */
public record ByteRange(int start, int end) {

    public static ByteRange of(int start, int end) {
        return new ByteRange(start, end);
    }

    /** An empty range at {@code offset}, used for pure insertions. */
    public static ByteRange at(int offset) {
        return new ByteRange(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
