package io.spectr.markdown.api;

/**
 * Closed set of node kinds produced by the parser.
 */
public enum NodeKind {
    DOCUMENT,
    /** ATX header, level 1 to 6. */
    HEADER,
    PARAGRAPH,
    /** Fenced code block including both fences. Leaf. */
    CODE_BLOCK,
    LIST,
    LIST_ITEM,
    /** List item carrying a {@code [ ]} or {@code [x]} checkbox. */
    TASK_ITEM,
    TEXT,
    /** {@code [[target|display#anchor]]}. Leaf. */
    WIKI_LINK,
    EMPHASIS,
    STRONG,
    /** Inline code delimited by equal backtick runs. Leaf. */
    CODE_SPAN,
    /** Syntax bytes such as markers, indentation, newlines and blank lines. Leaf. */
    TRIVIA;

    /** Whether nodes of this kind never have children. */
    public boolean isLeaf() {
        switch (this) {
            case TEXT:
            case WIKI_LINK:
            case CODE_BLOCK:
            case CODE_SPAN:
            case TRIVIA:
                return true;
            default:
                return false;
        }
    }

    public boolean isBlock() {
        switch (this) {
            case HEADER:
            case PARAGRAPH:
            case CODE_BLOCK:
            case LIST:
            case LIST_ITEM:
            case TASK_ITEM:
                return true;
            default:
                return false;
        }
    }
}
