package io.spectr.markdown.api;

/**
 * Base exception for checked markdown engine errors.
 * The context and error code are appended to the message for diagnostics.
 */
public abstract class MarkdownException extends Exception {
    private final String errorCode;

    protected MarkdownException(String message, String context, String errorCode) {
        super(message + " [Context: " + context + "] [Error Code: " + errorCode + "]");
        this.errorCode = errorCode;
    }

    /** Stable code of the error family, such as {@code ENCODING} or {@code INCREMENTAL}. */
    public String getErrorCode() {
        return errorCode;
    }
}
