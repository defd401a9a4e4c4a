package io.spectr.markdown.api;

/**
 * Traversal signal returned by {@link Visitor} callbacks.
 */
public enum VisitResult {
    /** Descend into the children of the current node. */
    CONTINUE,
    /** Do not descend into the current node; proceed with its next sibling. */
    SKIP_CHILDREN,
    /** Abort the traversal. */
    STOP
}
