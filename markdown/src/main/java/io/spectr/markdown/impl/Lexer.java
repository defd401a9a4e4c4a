package io.spectr.markdown.impl;

import java.util.ArrayList;
import java.util.List;

/**
 * Line oriented scanner turning UTF-8 source bytes into a gapless token stream.
 *
 * <p>Every byte of the scanned range belongs to exactly one token. Block structure is
 * recognized at the start of each line; the remainder of a line is split into inline tokens.
 * The only state carried from one line to the next is whether a fenced code block is open,
 * so a scan may start at any line that is not inside a fence.
 *
 * <p>Whitespace between list marker, checkbox, task id and description is matched as zero or
 * more spaces or tabs at every position.
 */
public final class Lexer {
    private final byte[] src;
    private final int limit;
    private int pos;
    // length of the open fence, 0 when not inside a fenced block
    private int fenceLength;

    public Lexer(byte[] src) {
        this(src, 0, src.length);
    }

    public Lexer(byte[] src, int from, int to) {
        this.src = src;
        this.pos = from;
        this.limit = to;
    }

    /**
     * Scans the whole input.
     *
     * @param src UTF-8 source bytes
     * @return the token stream covering every byte of {@code src}
     */
    public static List<Token> tokenize(byte[] src) {
        Lexer lexer = new Lexer(src);
        List<Token> tokens = new ArrayList<>();
        List<Token> line = new ArrayList<>();
        while (lexer.nextLine(line)) {
            tokens.addAll(line);
        }
        return tokens;
    }

    /** Offset of the next unscanned byte. */
    public int position() {
        return pos;
    }

    public boolean inFence() {
        return fenceLength > 0;
    }

    /**
     * Scans the next line into {@code out}, replacing its previous contents.
     *
     * @return {@code false} when the input is exhausted
     */
    public boolean nextLine(List<Token> out) {
        out.clear();
        if (pos >= limit) {
            return false;
        }
        int lineStart = pos;
        int eol = lineStart;
        while (eol < limit && src[eol] != '\n') {
            eol++;
        }
        int contentEnd = eol;
        int lineEnd = eol;
        if (eol < limit) {
            lineEnd = eol + 1;
            if (eol > lineStart && src[eol - 1] == '\r') {
                contentEnd = eol - 1;
            }
        }
        if (fenceLength > 0) {
            scanFencedLine(out, lineStart, contentEnd);
        } else if (skipWs(lineStart, contentEnd) == contentEnd) {
            out.add(new Token(TokenKind.BLANK_LINE, lineStart, lineEnd));
            pos = lineEnd;
            return true;
        } else {
            scanLine(out, lineStart, contentEnd);
        }
        if (lineEnd > contentEnd) {
            out.add(new Token(TokenKind.NEWLINE, contentEnd, lineEnd));
        }
        pos = lineEnd;
        return true;
    }

    private void scanFencedLine(List<Token> out, int start, int end) {
        int i = skipWs(start, end);
        int ticks = run(i, end, (byte) '`');
        if (ticks >= fenceLength && skipWs(i + ticks, end) == end) {
            ws(out, start, i);
            out.add(new Token(TokenKind.FENCE_CLOSE, i, i + ticks));
            ws(out, i + ticks, end);
            fenceLength = 0;
        } else if (end > start) {
            out.add(new Token(TokenKind.CODE_LINE, start, end));
        }
    }

    private void scanLine(List<Token> out, int start, int end) {
        int i = skipWs(start, end);
        ws(out, start, i);
        byte c = src[i];
        switch (c) {
            case '#': {
                int n = run(i, end, (byte) '#');
                if (i + n == end || isWs(src[i + n])) {
                    out.add(new Token(TokenKind.HEADING_MARKER, i, i + n));
                    int j = skipWs(i + n, end);
                    ws(out, i + n, j);
                    scanInline(out, j, end);
                    return;
                }
                break;
            }
            case '`': {
                int n = run(i, end, (byte) '`');
                if (n >= 3 && indexOf(i + n, end, (byte) '`') < 0) {
                    out.add(new Token(TokenKind.FENCE_OPEN, i, i + n));
                    int j = skipWs(i + n, end);
                    ws(out, i + n, j);
                    if (j < end) {
                        out.add(new Token(TokenKind.FENCE_INFO, j, end));
                    }
                    fenceLength = n;
                    return;
                }
                break;
            }
            case '-':
            case '*':
            case '+': {
                if (i + 1 == end || isWs(src[i + 1])) {
                    out.add(new Token(TokenKind.LIST_MARKER, i, i + 1));
                    if (c == '-') {
                        scanTaskTail(out, i + 1, end);
                    } else {
                        int j = skipWs(i + 1, end);
                        ws(out, i + 1, j);
                        scanInline(out, j, end);
                    }
                    return;
                }
                if (c == '-' && isCheckbox(i + 1, end)) {
                    out.add(new Token(TokenKind.LIST_MARKER, i, i + 1));
                    scanTaskTail(out, i + 1, end);
                    return;
                }
                break;
            }
            default: {
                int digits = digits(i, end);
                int k = i + digits;
                if (digits >= 1 && digits <= 9 && k < end && (src[k] == '.' || src[k] == ')')
                        && (k + 1 == end || isWs(src[k + 1]))) {
                    out.add(new Token(TokenKind.LIST_MARKER, i, k + 1));
                    int j = skipWs(k + 1, end);
                    ws(out, k + 1, j);
                    scanInline(out, j, end);
                    return;
                }
                break;
            }
        }
        scanInline(out, i, end);
    }

    // "-" already consumed: ws* ( "[" mark "]" ws* ( id ws+ )? )? text
    private void scanTaskTail(List<Token> out, int from, int end) {
        int i = skipWs(from, end);
        ws(out, from, i);
        if (!isCheckbox(i, end)) {
            scanInline(out, i, end);
            return;
        }
        out.add(new Token(TokenKind.CHECKBOX_OPEN, i, i + 1));
        out.add(new Token(TokenKind.CHECKBOX_MARK, i + 1, i + 2));
        out.add(new Token(TokenKind.CHECKBOX_CLOSE, i + 2, i + 3));
        int j = skipWs(i + 3, end);
        ws(out, i + 3, j);
        int idEnd = taskId(j, end);
        if (idEnd > j && idEnd < end && isWs(src[idEnd])) {
            int k = skipWs(idEnd, end);
            if (k < end) {
                out.add(new Token(TokenKind.TASK_ID, j, idEnd));
                ws(out, idEnd, k);
                j = k;
            }
        }
        scanInline(out, j, end);
    }

    private void scanInline(List<Token> out, int from, int end) {
        int i = from;
        int textStart = -1;
        while (i < end) {
            byte c = src[i];
            TokenKind kind = null;
            int n = 0;
            if (c == '`') {
                kind = TokenKind.BACKTICK_RUN;
                n = run(i, end, c);
            } else if (c == '*' || c == '_') {
                kind = TokenKind.EMPHASIS_RUN;
                n = run(i, end, c);
            } else if (c == '[' && i + 1 < end && src[i + 1] == '[') {
                kind = TokenKind.WIKILINK_OPEN;
                n = 2;
            } else if (c == ']' && i + 1 < end && src[i + 1] == ']') {
                kind = TokenKind.WIKILINK_CLOSE;
                n = 2;
            }
            if (kind == null) {
                if (textStart < 0) {
                    textStart = i;
                }
                // an escaped ASCII punctuation byte never starts a token
                i += (c == '\\' && i + 1 < end && isPunct(src[i + 1])) ? 2 : 1;
                continue;
            }
            if (textStart >= 0) {
                out.add(new Token(TokenKind.TEXT_RUN, textStart, i));
                textStart = -1;
            }
            out.add(new Token(kind, i, i + n));
            i += n;
        }
        if (textStart >= 0) {
            out.add(new Token(TokenKind.TEXT_RUN, textStart, end));
        }
    }

    private boolean isCheckbox(int i, int end) {
        if (i + 3 > end) {
            return false;
        }
        byte mark = src[i + 1];
        return src[i] == '[' && (mark == ' ' || mark == 'x' || mark == 'X') && src[i + 2] == ']';
    }

    // end offset of a dotted id \d+(\.\d+)* starting at i, or i when there is none
    private int taskId(int i, int end) {
        int k = i + digits(i, end);
        if (k == i) {
            return i;
        }
        while (k + 1 < end && src[k] == '.' && isDigit(src[k + 1])) {
            k = k + 1 + digits(k + 1, end);
        }
        return k;
    }

    private void ws(List<Token> out, int start, int end) {
        if (end > start) {
            out.add(new Token(TokenKind.WHITESPACE, start, end));
        }
    }

    private int skipWs(int i, int end) {
        while (i < end && isWs(src[i])) {
            i++;
        }
        return i;
    }

    private int run(int i, int end, byte c) {
        int k = i;
        while (k < end && src[k] == c) {
            k++;
        }
        return k - i;
    }

    private int digits(int i, int end) {
        int k = i;
        while (k < end && isDigit(src[k])) {
            k++;
        }
        return k - i;
    }

    private int indexOf(int i, int end, byte c) {
        for (int k = i; k < end; k++) {
            if (src[k] == c) {
                return k;
            }
        }
        return -1;
    }

    static boolean isWs(byte b) {
        return b == ' ' || b == '\t';
    }

    static boolean isDigit(byte b) {
        return b >= '0' && b <= '9';
    }

    static boolean isPunct(byte b) {
        return (b >= '!' && b <= '/') || (b >= ':' && b <= '@') || (b >= '[' && b <= '`') || (b >= '{' && b <= '~');
    }
}
