package io.spectr.markdown.impl;

import io.spectr.markdown.api.NodeKind;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Builds the block structure of a document from the lexer's line stream.
 *
 * <p>Open blocks live on an explicit container stack: the document at the bottom, then
 * alternating lists and list items, with an open paragraph or code block on top. Each line is
 * routed to one container without backtracking:
 *
 * <ul>
 *   <li>a header closes every open container;
 *   <li>a list marker joins the deepest open item whose content column does not exceed the
 *       marker column, continuing that item's list when the ordered flag matches;
 *   <li>a fence or text line goes to the deepest open item whose content column does not
 *       exceed the line's indentation, or to the document;
 *   <li>a text line directly after an open paragraph continues it regardless of indentation.
 * </ul>
 *
 * Blank lines are held back and attached to whichever container receives the next block, so
 * every container span is contiguous and the leaves of the tree cover the input exactly.
 */
public final class BlockParser {
    private static final int TAB_STOP = 4;

    private final byte[] src;
    private final NodeArena arena;
    private final Lexer lexer;
    private final InlineParser inline;
    private final IntPredicate stopAt;

    private final List<Token> line = new ArrayList<>();
    private final List<Frame> stack = new ArrayList<>();
    // start/end pairs of blank lines waiting for their container
    private final IntArrayList pendingBlanks = new IntArrayList();
    private int stoppedAt = -1;

    private BlockParser(byte[] src, int from, NodeArena arena, IntPredicate stopAt) {
        this.src = src;
        this.arena = arena;
        this.lexer = new Lexer(src, from, src.length);
        this.inline = new InlineParser(src, arena);
        this.stopAt = stopAt;
    }

    /**
     * Result of parsing a run of top-level blocks.
     *
     * @param children ids of the produced top-level nodes in document order
     * @param stoppedAt offset at which the stop predicate accepted, or -1 when the input ended
     */
    public record Blocks(int[] children, int stoppedAt) {}

    /**
     * Parses a whole document into {@code arena}.
     *
     * @return the id of the document node
     */
    public static int parseDocument(byte[] src, NodeArena arena) {
        int root = arena.allocate(NodeKind.DOCUMENT, 0, src.length);
        Blocks blocks = parseBlocks(src, 0, arena, null);
        arena.setChildren(root, blocks.children());
        return root;
    }

    /**
     * Parses top-level blocks starting at {@code from}, which must be the start of a line
     * outside any fenced block.
     *
     * @param stopAt consulted with the offset of every top-level node about to be created;
     *     parsing ends before that node when it returns {@code true}. May be {@code null}.
     */
    public static Blocks parseBlocks(byte[] src, int from, NodeArena arena, IntPredicate stopAt) {
        return new BlockParser(src, from, arena, stopAt).run();
    }

    private Blocks run() {
        Frame doc = new Frame(NodeKind.DOCUMENT, -1);
        stack.add(doc);
        while (stoppedAt < 0 && lexer.nextLine(line)) {
            processLine();
        }
        if (stoppedAt < 0) {
            closeTo(0);
            flushBlanks(0);
        }
        return new Blocks(doc.children.toIntArray(), stoppedAt);
    }

    private void processLine() {
        Frame top = top();
        if (top.kind == NodeKind.CODE_BLOCK) {
            codeLine(top);
            return;
        }
        Token first = line.get(0);
        if (first.kind() == TokenKind.BLANK_LINE) {
            if (top.kind == NodeKind.PARAGRAPH) {
                closeTo(stack.size() - 2);
            }
            pendingBlanks.add(first.start());
            pendingBlanks.add(first.end());
            return;
        }
        int i = first.kind() == TokenKind.WHITESPACE ? 1 : 0;
        int indent = i == 1 ? columns(first.start(), first.end(), 0) : 0;
        switch (line.get(i).kind()) {
            case HEADING_MARKER:
                header(i);
                break;
            case FENCE_OPEN:
                fence(indent);
                break;
            case LIST_MARKER:
                listItem(i, indent);
                break;
            default:
                text(indent);
                break;
        }
    }

    // ---- block kinds ----

    private void header(int markerIndex) {
        if (!enter(0)) {
            return;
        }
        int lineStart = line.get(0).start();
        Token marker = line.get(markerIndex);
        int contentFrom = markerIndex + 1;
        if (contentFrom < line.size() && line.get(contentFrom).kind() == TokenKind.WHITESPACE) {
            contentFrom++;
        }
        int contentTo = line.size();
        if (last().kind() == TokenKind.NEWLINE) {
            contentTo--;
        }
        int id = arena.allocate(NodeKind.HEADER, lineStart, last().end());
        IntArrayList kids = new IntArrayList();
        int prefixEnd = contentFrom < contentTo ? line.get(contentFrom).start() : line.get(contentTo - 1).end();
        kids.add(arena.allocate(NodeKind.TRIVIA, lineStart, prefixEnd));
        inline.parse(line, contentFrom, contentTo, kids);
        if (contentTo < line.size()) {
            Token nl = line.get(contentTo);
            kids.add(arena.allocate(NodeKind.TRIVIA, nl.start(), nl.end()));
        }
        arena.setChildren(id, kids);
        int textStart = prefixEnd;
        int textEnd = contentTo > 0 ? line.get(contentTo - 1).end() : prefixEnd;
        arena.setAttributes(id, new NodeAttributes.Heading(
            Math.min(marker.length(), 6), headerText(string(textStart, Math.max(textStart, textEnd)))));
        top().children.add(id);
    }

    static String headerText(String raw) {
        String text = raw.strip();
        int k = text.length();
        while (k > 0 && text.charAt(k - 1) == '#') {
            k--;
        }
        if (k == 0) {
            return "";
        }
        if (k < text.length() && (text.charAt(k - 1) == ' ' || text.charAt(k - 1) == '\t')) {
            return text.substring(0, k).strip();
        }
        return text;
    }

    private void fence(int indent) {
        closeParagraph();
        if (!enter(itemForIndent(indent))) {
            return;
        }
        String info = "";
        for (Token t : line) {
            if (t.kind() == TokenKind.FENCE_INFO) {
                info = string(t.start(), t.end()).strip();
            }
        }
        int start = line.get(0).start();
        int id = arena.allocate(NodeKind.CODE_BLOCK, start, last().end());
        top().children.add(id);
        Frame code = new Frame(NodeKind.CODE_BLOCK, id);
        code.info = info;
        code.contentStart = last().end();
        stack.add(code);
    }

    private void codeLine(Frame code) {
        int lineEnd = last().end();
        arena.setSpan(code.id, arena.start(code.id), lineEnd);
        for (Token t : line) {
            if (t.kind() == TokenKind.FENCE_CLOSE) {
                code.contentEnd = line.get(0).start();
                closeTo(stack.size() - 2);
                return;
            }
        }
    }

    private void listItem(int markerIndex, int indent) {
        closeParagraph();
        Token marker = line.get(markerIndex);
        boolean ordered = src[marker.start()] != '-' && src[marker.start()] != '*' && src[marker.start()] != '+';
        int item = itemForIndent(indent);
        int container;
        if (item + 1 < stack.size() && stack.get(item + 1).kind == NodeKind.LIST
                && stack.get(item + 1).ordered == ordered) {
            container = item + 1;
        } else {
            container = item;
        }
        if (!enter(container)) {
            return;
        }
        int lineStart = line.get(0).start();
        if (top().kind != NodeKind.LIST) {
            int list = arena.allocate(NodeKind.LIST, lineStart, lineStart);
            arena.setAttributes(list, new NodeAttributes.ListInfo(ordered));
            top().children.add(list);
            Frame frame = new Frame(NodeKind.LIST, list);
            frame.ordered = ordered;
            stack.add(frame);
        }

        // prefix: indentation, marker, checkbox, id and the whitespace between them
        int i = markerIndex + 1;
        Token mark = null;
        Token taskId = null;
        while (i < line.size()) {
            Token t = line.get(i);
            if (t.kind() == TokenKind.CHECKBOX_MARK) {
                mark = t;
            } else if (t.kind() == TokenKind.TASK_ID) {
                taskId = t;
            } else if (t.kind() != TokenKind.WHITESPACE && t.kind() != TokenKind.CHECKBOX_OPEN
                    && t.kind() != TokenKind.CHECKBOX_CLOSE) {
                break;
            }
            i++;
        }
        boolean hasContent = i < line.size() && line.get(i).kind() != TokenKind.NEWLINE;
        int prefixEnd = hasContent ? line.get(i).start() : last().end();

        int markerEnd = marker.end();
        int afterMarker = columns(marker.start(), markerEnd, indent);
        int wsEnd = markerIndex + 1 < line.size() && line.get(markerIndex + 1).kind() == TokenKind.WHITESPACE
            ? line.get(markerIndex + 1).end() : markerEnd;
        int width = columns(markerEnd, wsEnd, afterMarker) - afterMarker;
        int contentCol = afterMarker + (width >= 1 && width <= 4 ? width : 1);

        NodeKind kind = mark != null ? NodeKind.TASK_ITEM : NodeKind.LIST_ITEM;
        int id = arena.allocate(kind, lineStart, prefixEnd);
        top().children.add(id);
        Frame frame = new Frame(kind, id);
        frame.contentCol = contentCol;
        frame.children.add(arena.allocate(NodeKind.TRIVIA, lineStart, prefixEnd));
        stack.add(frame);
        if (mark != null) {
            String description = "";
            if (hasContent) {
                int contentEnd = last().kind() == TokenKind.NEWLINE ? last().start() : last().end();
                description = string(prefixEnd, contentEnd).strip();
            }
            boolean checked = src[mark.start()] == 'x' || src[mark.start()] == 'X';
            String idText = taskId == null ? null : string(taskId.start(), taskId.end());
            arena.setAttributes(id, new NodeAttributes.Task(idText, checked, description, mark.start() - lineStart));
        }
        if (hasContent) {
            openParagraph(i, false);
        }
    }

    private void text(int indent) {
        Frame top = top();
        if (top.kind == NodeKind.PARAGRAPH && pendingBlanks.isEmpty()) {
            top.tokens.addAll(line);
            return;
        }
        closeParagraph();
        if (!enter(itemForIndent(indent))) {
            return;
        }
        openParagraph(0, true);
    }

    private void openParagraph(int from, boolean leadingTrivia) {
        int id = arena.allocate(NodeKind.PARAGRAPH, line.get(from).start(), last().end());
        top().children.add(id);
        Frame frame = new Frame(NodeKind.PARAGRAPH, id);
        frame.tokens = new ArrayList<>(line.subList(from, line.size()));
        frame.leadingTrivia = leadingTrivia;
        stack.add(frame);
    }

    // ---- container stack ----

    /**
     * Closes every frame above {@code container}, attaches pending blank lines to it and
     * reports whether parsing continues. Top-level entries consult the stop predicate first.
     */
    private boolean enter(int container) {
        closeTo(container);
        if (container == 0 && stopAt != null) {
            return flushBlanks(0) && !stop(line.get(0).start());
        }
        flushBlanks(container);
        return true;
    }

    private boolean stop(int offset) {
        if (stopAt.test(offset)) {
            stoppedAt = offset;
            return true;
        }
        return false;
    }

    private boolean flushBlanks(int container) {
        Frame target = stack.get(container);
        for (int k = 0; k < pendingBlanks.size(); k += 2) {
            int start = pendingBlanks.getInt(k);
            if (container == 0 && stopAt != null && stop(start)) {
                pendingBlanks.clear();
                return false;
            }
            target.children.add(arena.allocate(NodeKind.TRIVIA, start, pendingBlanks.getInt(k + 1)));
        }
        pendingBlanks.clear();
        return true;
    }

    /** Index of the deepest open item whose content column is at most {@code indent}, or 0. */
    private int itemForIndent(int indent) {
        for (int k = stack.size() - 1; k > 0; k--) {
            Frame f = stack.get(k);
            if ((f.kind == NodeKind.LIST_ITEM || f.kind == NodeKind.TASK_ITEM) && f.contentCol <= indent) {
                return k;
            }
        }
        return 0;
    }

    private void closeParagraph() {
        if (top().kind == NodeKind.PARAGRAPH) {
            closeTo(stack.size() - 2);
        }
    }

    private void closeTo(int index) {
        while (stack.size() > index + 1) {
            close(stack.remove(stack.size() - 1));
        }
    }

    private void close(Frame frame) {
        switch (frame.kind) {
            case PARAGRAPH:
                closeParagraph(frame);
                break;
            case CODE_BLOCK: {
                int end = frame.contentEnd >= 0 ? frame.contentEnd : arena.end(frame.id);
                int start = Math.min(frame.contentStart, end);
                String content = string(start, end);
                String lang = frame.info.isEmpty() ? "" : frame.info.split("[ \t]", 2)[0];
                arena.setAttributes(frame.id, new NodeAttributes.Code(frame.info, lang, content));
                break;
            }
            default: {
                int[] kids = frame.children.toIntArray();
                arena.setChildren(frame.id, kids);
                arena.setSpan(frame.id, arena.start(kids[0]), arena.end(kids[kids.length - 1]));
                break;
            }
        }
    }

    private void closeParagraph(Frame frame) {
        List<Token> tokens = frame.tokens;
        IntArrayList kids = new IntArrayList();
        int from = 0;
        int to = tokens.size();
        if (frame.leadingTrivia && tokens.get(0).kind() == TokenKind.WHITESPACE) {
            kids.add(arena.allocate(NodeKind.TRIVIA, tokens.get(0).start(), tokens.get(0).end()));
            from = 1;
        }
        Token tail = tokens.get(to - 1);
        boolean newline = tail.kind() == TokenKind.NEWLINE;
        if (newline) {
            to--;
        }
        inline.parse(tokens, from, to, kids);
        if (newline) {
            kids.add(arena.allocate(NodeKind.TRIVIA, tail.start(), tail.end()));
        }
        arena.setChildren(frame.id, kids);
        arena.setSpan(frame.id, tokens.get(0).start(), tail.end());
    }

    // ---- helpers ----

    private Frame top() {
        return stack.get(stack.size() - 1);
    }

    private Token last() {
        return line.get(line.size() - 1);
    }

    private int columns(int start, int end, int col) {
        for (int k = start; k < end; k++) {
            col = src[k] == '\t' ? (col / TAB_STOP + 1) * TAB_STOP : col + 1;
        }
        return col;
    }

    private String string(int start, int end) {
        return new String(src, start, end - start, StandardCharsets.UTF_8);
    }

    private static final class Frame {
        final NodeKind kind;
        final int id;
        final IntArrayList children = new IntArrayList();
        int contentCol;
        boolean ordered;
        List<Token> tokens;
        boolean leadingTrivia;
        String info = "";
        int contentStart;
        int contentEnd = -1;

        Frame(NodeKind kind, int id) {
            this.kind = kind;
            this.id = id;
        }
    }
}
