package io.spectr.markdown.api;

import io.spectr.markdown.impl.NodeArena;
import io.spectr.markdown.impl.NodeAttributes;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of one node of a {@link Document}.
 *
 * <p>Handles are cheap value objects; two handles are equal when they refer to the same node of
 * the same document. Kind specific accessors return a neutral value ({@code 0}, {@code false},
 * {@code ""} or {@code null} where documented) for nodes of other kinds.
 *
 * @param document the owning document
 * @param id arena id of the node
 */
public record NodeHandle(Document document, int id) {

    private NodeArena arena() {
        return document.arena();
    }

    public NodeKind kind() {
        return arena().kind(id);
    }

    public int start() {
        return arena().start(id);
    }

    public int end() {
        return arena().end(id);
    }

    public ByteRange span() {
        return new ByteRange(start(), end());
    }

    /** The printed bytes of this node, decoded as UTF-8. */
    public String raw() {
        byte[] printed = document.printBytes(id);
        return new String(printed, StandardCharsets.UTF_8);
    }

    /** 1-based line of the first byte of this node. */
    public int line() {
        return document.lineIndex().line(start());
    }

    public boolean isLeaf() {
        return kind().isLeaf();
    }

    public Optional<NodeHandle> parent() {
        int p = arena().parent(id);
        return p < 0 ? Optional.empty() : Optional.of(new NodeHandle(document, p));
    }

    /**
     * The enclosing node in the section hierarchy: top-level nodes belong to the nearest preceding
     * top-level header of a lower level (of any level for nodes other than headers), nested nodes
     * to their tree parent. Empty for the document node.
     */
    public Optional<NodeHandle> scopeParent() {
        int p = document.scopeParent(id);
        return p < 0 ? Optional.empty() : Optional.of(new NodeHandle(document, p));
    }

    public int childCount() {
        return arena().children(id).length;
    }

    public NodeHandle child(int index) {
        return new NodeHandle(document, arena().children(id)[index]);
    }

    public List<NodeHandle> children() {
        int[] kids = arena().children(id);
        if (kids.length == 0) {
            return Collections.emptyList();
        }
        List<NodeHandle> out = new ArrayList<>(kids.length);
        for (int kid : kids) {
            out.add(new NodeHandle(document, kid));
        }
        return out;
    }

    /** Children other than trivia. */
    public List<NodeHandle> contentChildren() {
        List<NodeHandle> out = new ArrayList<>();
        for (int kid : arena().children(id)) {
            if (arena().kind(kid) != NodeKind.TRIVIA) {
                out.add(new NodeHandle(document, kid));
            }
        }
        return out;
    }

    /** Header level, 0 for other kinds. */
    public int level() {
        return arena().attributes(id) instanceof NodeAttributes.Heading h ? h.level() : 0;
    }

    /** Whether this is an ordered list. */
    public boolean ordered() {
        return arena().attributes(id) instanceof NodeAttributes.ListInfo l && l.ordered();
    }

    /** Checkbox state of a task item, reflecting {@link Document#withTaskChecked}. */
    public boolean checked() {
        return document.isChecked(id);
    }

    /** Dotted task id, {@code null} when the task has none or this is not a task. */
    public String taskId() {
        return arena().attributes(id) instanceof NodeAttributes.Task t ? t.id() : null;
    }

    public String description() {
        return arena().attributes(id) instanceof NodeAttributes.Task t ? t.description() : "";
    }

    /** Language of a code block, the first word of its info string. */
    public String lang() {
        return arena().attributes(id) instanceof NodeAttributes.Code c ? c.lang() : "";
    }

    /** Full info string of a code block. */
    public String info() {
        return arena().attributes(id) instanceof NodeAttributes.Code c ? c.info() : "";
    }

    /** Content of a code block or code span. */
    public String content() {
        Object attrs = arena().attributes(id);
        if (attrs instanceof NodeAttributes.Code c) {
            return c.content();
        }
        return attrs instanceof NodeAttributes.Span s ? s.content() : "";
    }

    public String target() {
        return arena().attributes(id) instanceof NodeAttributes.Link l ? l.target() : "";
    }

    public String display() {
        return arena().attributes(id) instanceof NodeAttributes.Link l ? l.display() : "";
    }

    public String anchor() {
        return arena().attributes(id) instanceof NodeAttributes.Link l ? l.anchor() : "";
    }

    /**
     * Plain text of this node: the header text, task description, code content or link label
     * for those kinds, the raw bytes for text and trivia, and the concatenated text of the
     * non-trivia children otherwise (block children separated by a newline).
     */
    public String text() {
        switch (kind()) {
            case HEADER:
                return ((NodeAttributes.Heading) arena().attributes(id)).text();
            case TASK_ITEM:
                return description();
            case CODE_BLOCK:
            case CODE_SPAN:
                return content();
            case WIKI_LINK:
                return display().isEmpty() ? target() : display();
            case TEXT:
            case TRIVIA:
                return raw();
            case PARAGRAPH:
            case EMPHASIS:
            case STRONG:
                return joinText("");
            case DOCUMENT:
            case LIST:
            case LIST_ITEM:
                return joinText("\n");
            default:
                throw new IllegalStateException("unhandled kind " + kind());
        }
    }

    private String joinText(String separator) {
        StringBuilder sb = new StringBuilder();
        for (NodeHandle child : contentChildren()) {
            if (sb.length() > 0) {
                sb.append(separator);
            }
            sb.append(child.text());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return kind() + "#" + id + span();
    }
}
