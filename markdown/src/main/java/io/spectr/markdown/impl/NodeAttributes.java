package io.spectr.markdown.impl;

/**
 * Kind specific payloads stored in the attribute column of a {@link NodeArena}.
 */
public final class NodeAttributes {
    private NodeAttributes() {}

    /** Header level and its text without markers. */
    public record Heading(int level, String text) {}

    /** Code block info string, language (first word of the info string) and raw content. */
    public record Code(String info, String lang, String content) {}

    /** Ordered flag of a list. */
    public record ListInfo(boolean ordered) {}

    /**
     * Task item state.
     *
     * @param id dotted id, {@code null} when the item carries none
     * @param checked checkbox state as parsed
     * @param description first line text after checkbox and id
     * @param markDelta offset of the checkbox state byte relative to the item start
     */
    public record Task(String id, boolean checked, String description, int markDelta) {

        public Task withChecked(boolean value) {
            return value == checked ? this : new Task(id, value, description, markDelta);
        }
    }

    /** Wikilink parts; display and anchor are empty when absent. */
    public record Link(String target, String display, String anchor) {}

    /** Code span content with the stripped single padding space. */
    public record Span(String content) {}
}
