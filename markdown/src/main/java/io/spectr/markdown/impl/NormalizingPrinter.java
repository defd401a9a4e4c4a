package io.spectr.markdown.impl;

import io.spectr.markdown.api.Document;
import io.spectr.markdown.api.NodeHandle;
import io.spectr.markdown.api.NodeKind;
import java.util.List;

/**
 * Renders a document in canonical markdown.
 *
 * <p>Headers use ATX markers followed by one space, bullets become {@code -}, ordered items are
 * renumbered from 1 with a {@code .} delimiter, checkboxes are written as {@code [ ]} or
 * {@code [x]} and top-level blocks are separated by exactly one blank line. Nested blocks are
 * indented to the content column of their item. Code block content is copied unchanged.
 */
public final class NormalizingPrinter {
    private NormalizingPrinter() {}

    public static String print(Document doc) {
        StringBuilder out = new StringBuilder();
        List<NodeHandle> blocks = doc.root().contentChildren();
        for (int i = 0; i < blocks.size(); i++) {
            if (i > 0) {
                out.append('\n');
            }
            block(blocks.get(i), "", out);
        }
        return out.toString();
    }

    private static void block(NodeHandle node, String indent, StringBuilder out) {
        switch (node.kind()) {
            case HEADER:
                out.append(indent).append("#".repeat(node.level()));
                String text = node.text();
                if (!text.isEmpty()) {
                    out.append(' ').append(text);
                    // text ending in a run of '#' would otherwise be read back as a closing sequence
                    if (!BlockParser.headerText(text).equals(text)) {
                        out.append(" #");
                    }
                }
                out.append('\n');
                break;
            case PARAGRAPH:
                paragraph(node, indent, "", out);
                break;
            case CODE_BLOCK:
                codeBlock(node, indent, out);
                break;
            case LIST: {
                int number = 1;
                for (NodeHandle item : node.contentChildren()) {
                    item(item, node.ordered() ? number++ + "." : "-", indent, out);
                }
                break;
            }
            case LIST_ITEM:
            case TASK_ITEM:
                item(node, "-", indent, out);
                break;
            default:
                throw new IllegalStateException("not a block: " + node);
        }
    }

    private static void item(NodeHandle item, String marker, String indent, StringBuilder out) {
        StringBuilder prefix = new StringBuilder(marker);
        if (item.kind() == NodeKind.TASK_ITEM) {
            prefix.append(item.checked() ? " [x]" : " [ ]");
            if (item.taskId() != null) {
                prefix.append(' ').append(item.taskId());
            }
        }
        String childIndent = indent + " ".repeat(marker.length() + 1);
        List<NodeHandle> children = item.contentChildren();
        int from = 0;
        if (!children.isEmpty() && children.get(0).kind() == NodeKind.PARAGRAPH
                && children.get(0).line() == item.line()) {
            paragraph(children.get(0), indent, prefix + " ", childIndent, out);
            from = 1;
        } else {
            out.append(indent).append(prefix).append('\n');
        }
        for (int i = from; i < children.size(); i++) {
            NodeHandle child = children.get(i);
            if (child.kind() == NodeKind.PARAGRAPH) {
                out.append('\n');
            }
            block(child, childIndent, out);
        }
    }

    private static void paragraph(NodeHandle node, String indent, String lead, StringBuilder out) {
        paragraph(node, indent, lead, indent, out);
    }

    private static void paragraph(NodeHandle node, String indent, String lead, String continuation,
                                  StringBuilder out) {
        StringBuilder text = new StringBuilder();
        for (NodeHandle child : node.contentChildren()) {
            inline(child, text);
        }
        String[] lines = text.toString().split("\r?\n");
        boolean first = true;
        for (String line : lines) {
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                continue;
            }
            out.append(first ? indent + lead : continuation).append(stripped).append('\n');
            first = false;
        }
    }

    private static void inline(NodeHandle node, StringBuilder out) {
        switch (node.kind()) {
            case TEXT:
            case CODE_SPAN:
                out.append(node.raw());
                break;
            case WIKI_LINK:
                out.append("[[").append(node.target());
                if (!node.display().isEmpty()) {
                    out.append('|').append(node.display());
                }
                if (!node.anchor().isEmpty()) {
                    out.append('#').append(node.anchor());
                }
                out.append("]]");
                break;
            case EMPHASIS:
            case STRONG: {
                String delimiter = node.kind() == NodeKind.STRONG ? "**" : "*";
                out.append(delimiter);
                for (NodeHandle child : node.contentChildren()) {
                    inline(child, out);
                }
                out.append(delimiter);
                break;
            }
            default:
                break;
        }
    }

    private static void codeBlock(NodeHandle node, String indent, StringBuilder out) {
        String content = node.content();
        String fence = "`".repeat(Math.max(3, longestBacktickRun(content) + 1));
        out.append(indent).append(fence).append(node.info()).append('\n');
        out.append(content);
        if (!content.isEmpty() && !content.endsWith("\n")) {
            out.append('\n');
        }
        out.append(indent).append(fence).append('\n');
    }

    private static int longestBacktickRun(String s) {
        int longest = 0;
        int run = 0;
        for (int i = 0; i < s.length(); i++) {
            run = s.charAt(i) == '`' ? run + 1 : 0;
            longest = Math.max(longest, run);
        }
        return longest;
    }
}
