package io.spectr.markdown.api;

/**
 * Exception thrown when a selector string cannot be compiled.
 */
public class QuerySyntaxException extends RuntimeException {
    private final int position;

    public QuerySyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public QuerySyntaxException(String message, int position, Throwable cause) {
        super(message + " at position " + position, cause);
        this.position = position;
    }

    /** Zero-based character position inside the selector where compilation failed. */
    public int position() {
        return position;
    }
}
