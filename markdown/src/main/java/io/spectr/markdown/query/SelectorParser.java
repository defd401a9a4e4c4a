package io.spectr.markdown.query;

import io.spectr.markdown.api.NodeKind;
import io.spectr.markdown.api.QuerySyntaxException;
import io.spectr.markdown.query.Selector.Attribute;
import io.spectr.markdown.query.Selector.Combinator;
import io.spectr.markdown.query.Selector.Condition;
import io.spectr.markdown.query.Selector.Operator;
import io.spectr.markdown.query.Selector.Step;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Recursive descent parser for node selectors.
 *
 * <p>Grammar:
 *
 * <pre>
 * selector   := step (combinator step)*
 * combinator := ws+ | ws* '>' ws*
 * step       := kind ('[' ws* attr ws* op ws* literal ws* ']')*
 * kind       := '*' | 'document' | 'header' | 'h1'..'h6' | 'paragraph' | 'code' | 'list'
 *             | 'item' | 'task' | 'text' | 'wikilink' | 'emphasis' | 'strong' | 'codespan'
 * attr       := 'level' | 'text' | 'lang' | 'content' | 'target' | 'id' | 'checked'
 *             | 'ordered' | 'description'
 * op         := '=' | '!=' | '^=' | '$=' | '*=' | '~' | '>' | '>=' | '<' | '<='
 * literal    := '"' chars '"' | "'" chars "'" | '-'? digits | 'true' | 'false'
 * </pre>
 *
 * {@code item} matches plain and task list items alike; {@code ~} takes a regular expression
 * that must occur somewhere in the attribute value.
 */
final class SelectorParser {

    private final String input;
    private int pos;

    private SelectorParser(String input) {
        this.input = input;
        this.pos = 0;
    }

    /**
     * Parses a selector string.
     *
     * @throws QuerySyntaxException if parsing fails
     */
    static Selector parse(String input) {
        if (input == null || input.isBlank()) {
            throw new QuerySyntaxException("Empty selector", 0);
        }
        return new SelectorParser(input).parseSelector();
    }

    private Selector parseSelector() {
        List<Step> steps = new ArrayList<>();
        List<Combinator> combinators = new ArrayList<>();
        skipWs();
        steps.add(parseStep());
        while (true) {
            boolean sawWs = skipWs();
            if (isAtEnd()) {
                break;
            }
            if (peek() == '>') {
                advance();
                skipWs();
                combinators.add(Combinator.CHILD);
            } else if (sawWs) {
                combinators.add(Combinator.DESCENDANT);
            } else {
                throw error("Unexpected character '" + peek() + "'");
            }
            steps.add(parseStep());
        }
        return new Selector(input, steps, combinators);
    }

    private Step parseStep() {
        int start = pos;
        String name;
        if (peek() == '*') {
            advance();
            name = "*";
        } else {
            name = identifier();
        }
        if (name.isEmpty()) {
            throw error("Expected node kind");
        }
        Set<NodeKind> kinds;
        int level = 0;
        switch (name) {
            case "*":
                kinds = Step.ANY;
                break;
            case "document":
                kinds = EnumSet.of(NodeKind.DOCUMENT);
                break;
            case "header":
                kinds = EnumSet.of(NodeKind.HEADER);
                break;
            case "h1":
            case "h2":
            case "h3":
            case "h4":
            case "h5":
            case "h6":
                kinds = EnumSet.of(NodeKind.HEADER);
                level = name.charAt(1) - '0';
                break;
            case "paragraph":
                kinds = EnumSet.of(NodeKind.PARAGRAPH);
                break;
            case "code":
                kinds = EnumSet.of(NodeKind.CODE_BLOCK);
                break;
            case "list":
                kinds = EnumSet.of(NodeKind.LIST);
                break;
            case "item":
                kinds = EnumSet.of(NodeKind.LIST_ITEM, NodeKind.TASK_ITEM);
                break;
            case "task":
                kinds = EnumSet.of(NodeKind.TASK_ITEM);
                break;
            case "text":
                kinds = EnumSet.of(NodeKind.TEXT);
                break;
            case "wikilink":
                kinds = EnumSet.of(NodeKind.WIKI_LINK);
                break;
            case "emphasis":
                kinds = EnumSet.of(NodeKind.EMPHASIS);
                break;
            case "strong":
                kinds = EnumSet.of(NodeKind.STRONG);
                break;
            case "codespan":
                kinds = EnumSet.of(NodeKind.CODE_SPAN);
                break;
            default:
                throw new QuerySyntaxException("Unknown node kind '" + name + "'", start);
        }
        List<Condition> conditions = new ArrayList<>();
        while (peek() == '[') {
            advance();
            conditions.add(parseCondition());
        }
        return new Step(kinds, level, conditions);
    }

    private Condition parseCondition() {
        skipWs();
        int start = pos;
        String name = identifier();
        Attribute attribute;
        try {
            attribute = Attribute.valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new QuerySyntaxException(name.isEmpty() ? "Expected attribute name" : "Unknown attribute '" + name + "'", start);
        }
        skipWs();
        Operator operator = parseOperator();
        skipWs();
        int literalStart = pos;
        Object literal = parseLiteral();
        skipWs();
        expect(']');
        Pattern pattern = null;
        if (operator == Operator.MATCHES) {
            try {
                pattern = Pattern.compile(literal.toString());
            } catch (PatternSyntaxException e) {
                throw new QuerySyntaxException("Invalid regular expression", literalStart, e);
            }
        }
        return new Condition(attribute, operator, literal, pattern);
    }

    private Operator parseOperator() {
        for (Operator op : Operator.values()) {
            if (input.startsWith(op.symbol(), pos)) {
                pos += op.symbol().length();
                return op;
            }
        }
        throw error("Expected operator");
    }

    private Object parseLiteral() {
        char c = peek();
        if (c == '"' || c == '\'') {
            return quoted(c);
        }
        if (c == '-' || Character.isDigit(c)) {
            int start = pos;
            if (c == '-') {
                advance();
            }
            while (Character.isDigit(peek())) {
                advance();
            }
            try {
                return Long.parseLong(input.substring(start, pos));
            } catch (NumberFormatException e) {
                throw new QuerySyntaxException("Invalid number", start, e);
            }
        }
        int start = pos;
        String word = identifier();
        if (word.equals("true") || word.equals("false")) {
            return Boolean.valueOf(word);
        }
        throw new QuerySyntaxException("Expected literal", start);
    }

    private String quoted(char quote) {
        int start = pos;
        advance();
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                c = advance();
            }
            sb.append(c);
        }
        if (isAtEnd()) {
            throw new QuerySyntaxException("Unterminated string", start);
        }
        advance();
        return sb.toString();
    }

    private String identifier() {
        int start = pos;
        while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
            pos++;
        }
        return input.substring(start, pos);
    }

    private boolean skipWs() {
        int start = pos;
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
        return pos > start;
    }

    private void expect(char c) {
        if (peek() != c) {
            throw error("Expected '" + c + "'");
        }
        advance();
    }

    private char peek() {
        return isAtEnd() ? '\0' : input.charAt(pos);
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private QuerySyntaxException error(String message) {
        return new QuerySyntaxException(message, pos);
    }
}
