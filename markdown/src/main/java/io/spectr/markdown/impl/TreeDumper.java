package io.spectr.markdown.impl;

import io.spectr.markdown.api.Document;
import io.spectr.markdown.api.NodeHandle;

/**
 * Renders a document tree as indented text, one node per line.
 */
public final class TreeDumper {
    private TreeDumper() {}

    public static String dump(Document doc) {
        StringBuilder sb = new StringBuilder();
        dump(doc.root(), 0, sb);
        return sb.toString();
    }

    private static void dump(NodeHandle node, int depth, StringBuilder sb) {
        sb.append("  ".repeat(depth)).append(node.kind()).append(' ').append(node.span());
        switch (node.kind()) {
            case HEADER:
                sb.append(" level=").append(node.level()).append(" text=").append(quote(node.text()));
                break;
            case CODE_BLOCK:
                sb.append(" lang=").append(quote(node.lang()));
                break;
            case LIST:
                sb.append(" ordered=").append(node.ordered());
                break;
            case TASK_ITEM:
                sb.append(" id=").append(node.taskId()).append(" checked=").append(node.checked())
                    .append(" description=").append(quote(node.description()));
                break;
            case WIKI_LINK:
                sb.append(" target=").append(quote(node.target()));
                break;
            case TEXT:
            case TRIVIA:
            case CODE_SPAN:
                sb.append(' ').append(quote(node.raw()));
                break;
            default:
                break;
        }
        sb.append('\n');
        for (NodeHandle child : node.children()) {
            dump(child, depth + 1, sb);
        }
    }

    private static String quote(String s) {
        return '"' + s.replace("\\", "\\\\").replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t") + '"';
    }
}
