package io.spectr.markdown.api;

/**
 * Exception thrown when an edit cannot be applied to a document.
 * The document the edit was aimed at is left untouched.
 */
public class IncrementalMismatchException extends MarkdownException {

    public IncrementalMismatchException(String message, String context) {
        super(message, context, "INCREMENTAL");
    }

    /**
     * Creates an exception for an edit range that is inverted or lies outside the document.
     *
     * @param range the rejected range
     * @param length the length of the document text in bytes
     * @return a new IncrementalMismatchException instance
     */
    public static IncrementalMismatchException outOfBounds(ByteRange range, int length) {
        return new IncrementalMismatchException(
            "Edit range outside document bounds",
            range + " on " + length + " bytes"
        );
    }

    /**
     * Creates an exception for an edit boundary that falls inside a multi-byte UTF-8 sequence.
     *
     * @param range the rejected range
     * @param offset the offending boundary
     * @return a new IncrementalMismatchException instance
     */
    public static IncrementalMismatchException splitsCharacter(ByteRange range, int offset) {
        return new IncrementalMismatchException(
            "Edit boundary splits a UTF-8 sequence",
            range + " at offset " + offset
        );
    }
}
