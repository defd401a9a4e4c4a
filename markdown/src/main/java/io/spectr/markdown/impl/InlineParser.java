package io.spectr.markdown.impl;

import io.spectr.markdown.api.NodeKind;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Resolves the inline structure of one block: code spans, wikilinks, emphasis and plain text.
 *
 * <p>Closers are looked up in tables computed by a single backward scan, so the pass is linear
 * in the number of tokens for each nesting level of emphasis.
 */
final class InlineParser {
    private final byte[] src;
    private final NodeArena arena;

    private List<Token> tokens;
    private int[] codeClose;
    private int[] linkClose;
    private int[] emphasisClose;

    InlineParser(byte[] src, NodeArena arena) {
        this.src = src;
        this.arena = arena;
    }

    /**
     * Parses {@code tokens[from, to)} and appends the ids of the produced nodes to {@code out}.
     */
    void parse(List<Token> tokens, int from, int to, IntArrayList out) {
        if (from >= to) {
            return;
        }
        this.tokens = tokens;
        computeClosers(from, to);
        parseRange(from, to, out);
        this.tokens = null;
    }

    private void computeClosers(int from, int to) {
        int n = to;
        codeClose = new int[n];
        linkClose = new int[n];
        emphasisClose = new int[n];
        Int2IntOpenHashMap nextTicks = new Int2IntOpenHashMap();
        nextTicks.defaultReturnValue(-1);
        Int2IntOpenHashMap nextEmphasis = new Int2IntOpenHashMap();
        nextEmphasis.defaultReturnValue(-1);
        int nextLinkClose = -1;
        for (int i = to - 1; i >= from; i--) {
            Token t = tokens.get(i);
            codeClose[i] = -1;
            linkClose[i] = -1;
            emphasisClose[i] = -1;
            switch (t.kind()) {
                case BACKTICK_RUN:
                    codeClose[i] = nextTicks.get(t.length());
                    nextTicks.put(t.length(), i);
                    break;
                case NEWLINE:
                    nextLinkClose = -1;
                    break;
                case WIKILINK_CLOSE:
                    nextLinkClose = i;
                    break;
                case WIKILINK_OPEN:
                    linkClose[i] = nextLinkClose;
                    break;
                case EMPHASIS_RUN: {
                    int key = emphasisKey(t);
                    if (canOpen(t)) {
                        emphasisClose[i] = nextEmphasis.get(key);
                    }
                    if (canClose(t)) {
                        nextEmphasis.put(key, i);
                    }
                    break;
                }
                default:
                    break;
            }
        }
        // a later opener shadows the closer of an earlier one: [[a [[b]]
        int open = -1;
        for (int i = from; i < to; i++) {
            TokenKind kind = tokens.get(i).kind();
            if (kind == TokenKind.WIKILINK_OPEN) {
                if (open >= 0 && linkClose[open] > i) {
                    linkClose[open] = -1;
                }
                open = i;
            } else if (kind == TokenKind.NEWLINE) {
                open = -1;
            }
        }
    }

    private void parseRange(int from, int to, IntArrayList out) {
        int textStart = -1;
        int textEnd = -1;
        int i = from;
        while (i < to) {
            Token t = tokens.get(i);
            int close = -1;
            switch (t.kind()) {
                case BACKTICK_RUN:
                    close = codeClose[i];
                    break;
                case WIKILINK_OPEN:
                    close = linkClose[i];
                    break;
                case EMPHASIS_RUN:
                    close = t.length() <= 2 && emphasisClose[i] > i + 1 ? emphasisClose[i] : -1;
                    break;
                default:
                    break;
            }
            if (close < 0 || close >= to) {
                if (textStart < 0) {
                    textStart = t.start();
                }
                textEnd = t.end();
                i++;
                continue;
            }
            if (textStart >= 0) {
                out.add(arena.allocate(NodeKind.TEXT, textStart, textEnd));
                textStart = -1;
            }
            Token closer = tokens.get(close);
            switch (t.kind()) {
                case BACKTICK_RUN:
                    out.add(codeSpan(t, closer));
                    break;
                case WIKILINK_OPEN:
                    out.add(wikiLink(t, closer));
                    break;
                default:
                    out.add(emphasis(i, close));
                    break;
            }
            i = close + 1;
        }
        if (textStart >= 0) {
            out.add(arena.allocate(NodeKind.TEXT, textStart, textEnd));
        }
    }

    private int codeSpan(Token open, Token close) {
        int id = arena.allocate(NodeKind.CODE_SPAN, open.start(), close.end());
        String content = text(open.end(), close.start());
        if (content.length() >= 2 && content.startsWith(" ") && content.endsWith(" ") && !content.isBlank()) {
            content = content.substring(1, content.length() - 1);
        }
        arena.setAttributes(id, new NodeAttributes.Span(content));
        return id;
    }

    private int wikiLink(Token open, Token close) {
        int id = arena.allocate(NodeKind.WIKI_LINK, open.start(), close.end());
        arena.setAttributes(id, parseLink(text(open.end(), close.start())));
        return id;
    }

    // target, target|display, target#anchor or target|display#anchor
    static NodeAttributes.Link parseLink(String content) {
        int pipe = content.indexOf('|');
        int hash = content.indexOf('#');
        if (pipe >= 0 && (hash < 0 || pipe < hash)) {
            String target = content.substring(0, pipe).trim();
            String rest = content.substring(pipe + 1);
            int h = rest.indexOf('#');
            if (h >= 0) {
                return new NodeAttributes.Link(target, rest.substring(0, h).trim(), rest.substring(h + 1).trim());
            }
            return new NodeAttributes.Link(target, rest.trim(), "");
        }
        if (hash >= 0) {
            return new NodeAttributes.Link(content.substring(0, hash).trim(), "", content.substring(hash + 1).trim());
        }
        return new NodeAttributes.Link(content.trim(), "", "");
    }

    private int emphasis(int open, int close) {
        Token o = tokens.get(open);
        Token c = tokens.get(close);
        NodeKind kind = o.length() == 2 ? NodeKind.STRONG : NodeKind.EMPHASIS;
        int id = arena.allocate(kind, o.start(), c.end());
        IntArrayList kids = new IntArrayList();
        kids.add(arena.allocate(NodeKind.TRIVIA, o.start(), o.end()));
        parseRange(open + 1, close, kids);
        kids.add(arena.allocate(NodeKind.TRIVIA, c.start(), c.end()));
        arena.setChildren(id, kids);
        return id;
    }

    private int emphasisKey(Token t) {
        return src[t.start()] * 64 + Math.min(t.length(), 63);
    }

    private boolean canOpen(Token t) {
        if (t.end() >= src.length || isSpace(src[t.end()])) {
            return false;
        }
        return src[t.start()] != '_' || t.start() == 0 || !isAlnum(src[t.start() - 1]);
    }

    private boolean canClose(Token t) {
        if (t.start() == 0 || isSpace(src[t.start() - 1])) {
            return false;
        }
        return src[t.start()] != '_' || t.end() >= src.length || !isAlnum(src[t.end()]);
    }

    private String text(int start, int end) {
        return new String(src, start, end - start, StandardCharsets.UTF_8);
    }

    private static boolean isSpace(byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r';
    }

    private static boolean isAlnum(byte b) {
        // bytes of multi-byte sequences count as word characters
        return (b >= '0' && b <= '9') || (b >= 'a' && b <= 'z') || (b >= 'A' && b <= 'Z') || b < 0;
    }
}
