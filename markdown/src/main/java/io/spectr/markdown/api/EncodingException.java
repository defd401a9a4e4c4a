package io.spectr.markdown.api;

/**
 * Exception thrown when the input of a parse is not well-formed UTF-8.
 */
public class EncodingException extends MarkdownException {
    private final int offset;

    /**
     * Constructs a new EncodingException.
     *
     * @param message the detail message
     * @param offset the byte offset of the first malformed or unmappable byte
     */
    public EncodingException(String message, int offset) {
        super(message, "offset " + offset, "ENCODING");
        this.offset = offset;
    }

    /**
     * Creates an EncodingException for a malformed byte sequence.
     *
     * @param offset the byte offset of the malformed sequence
     * @param length the length of the malformed sequence
     * @return a new EncodingException instance
     */
    public static EncodingException malformed(int offset, int length) {
        return new EncodingException("Malformed UTF-8 sequence of " + length + " byte(s)", offset);
    }

    /**
     * Returns the byte offset of the first invalid byte.
     *
     * @return the byte offset
     */
    public int getOffset() {
        return offset;
    }
}
