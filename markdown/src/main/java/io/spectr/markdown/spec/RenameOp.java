package io.spectr.markdown.spec;

/**
 * A requirement rename from a {@code RENAMED Requirements} section.
 *
 * @param from the old requirement name
 * @param to the new requirement name
 */
public record RenameOp(String from, String to) {}
