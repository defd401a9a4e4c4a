package io.spectr.markdown.api;

/**
 * Pre-order traversal callbacks, one per node kind.
 *
 * <p>Every callback defaults to {@link #visitNode(NodeHandle)}, which continues the traversal.
 * Implementations override only the kinds they care about.
 */
public interface Visitor {

    default VisitResult visitDocument(NodeHandle node) {
        return visitNode(node);
    }

    default VisitResult visitHeader(NodeHandle node) {
        return visitNode(node);
    }

    default VisitResult visitParagraph(NodeHandle node) {
        return visitNode(node);
    }

    default VisitResult visitCodeBlock(NodeHandle node) {
        return visitNode(node);
    }

    default VisitResult visitList(NodeHandle node) {
        return visitNode(node);
    }

    default VisitResult visitListItem(NodeHandle node) {
        return visitNode(node);
    }

    default VisitResult visitTaskItem(NodeHandle node) {
        return visitNode(node);
    }

    default VisitResult visitText(NodeHandle node) {
        return visitNode(node);
    }

    default VisitResult visitWikiLink(NodeHandle node) {
        return visitNode(node);
    }

    default VisitResult visitEmphasis(NodeHandle node) {
        return visitNode(node);
    }

    default VisitResult visitStrong(NodeHandle node) {
        return visitNode(node);
    }

    default VisitResult visitCodeSpan(NodeHandle node) {
        return visitNode(node);
    }

    default VisitResult visitTrivia(NodeHandle node) {
        return visitNode(node);
    }

    /** Fallback for every kind without a dedicated override. */
    default VisitResult visitNode(NodeHandle node) {
        return VisitResult.CONTINUE;
    }
}
