package io.spectr.markdown.query;

import io.spectr.markdown.api.NodeHandle;
import io.spectr.markdown.api.NodeKind;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * A compiled node selector.
 *
 * <p>A selector is a chain of steps joined by combinators. The last step is tested against the
 * candidate node; each preceding step is tested against its scope ancestors
 * ({@link NodeHandle#scopeParent()}), either the direct one ({@code >}) or any of them
 * (whitespace).
 */
public final class Selector implements Predicate<NodeHandle> {

    /** How two adjacent steps relate. */
    public enum Combinator {
        DESCENDANT,
        CHILD
    }

    /** Node attributes a condition can test. */
    public enum Attribute {
        LEVEL,
        TEXT,
        LANG,
        CONTENT,
        TARGET,
        ID,
        CHECKED,
        ORDERED,
        DESCRIPTION
    }

    /** Comparison operators, longest symbols first so that the parser can match greedily. */
    public enum Operator {
        NOT_EQUALS("!="),
        PREFIX("^="),
        SUFFIX("$="),
        CONTAINS("*="),
        GREATER_EQUALS(">="),
        LESS_EQUALS("<="),
        EQUALS("="),
        MATCHES("~"),
        GREATER(">"),
        LESS("<");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /**
     * One {@code [attribute op literal]} test. The literal is a {@link String}, {@link Long} or
     * {@link Boolean}; {@code pattern} is set for {@link Operator#MATCHES}.
     */
    public record Condition(Attribute attribute, Operator operator, Object literal, Pattern pattern) {}

    /**
     * A step: a set of node kinds, an optional header level (0 for any) and conditions.
     */
    public record Step(Set<NodeKind> kinds, int level, List<Condition> conditions) {

        static final Set<NodeKind> ANY = EnumSet.allOf(NodeKind.class);
    }

    private final String source;
    private final List<Step> steps;
    private final List<Combinator> combinators;

    Selector(String source, List<Step> steps, List<Combinator> combinators) {
        this.source = source;
        this.steps = List.copyOf(steps);
        this.combinators = List.copyOf(combinators);
    }

    /**
     * Compiles a selector string.
     *
     * @throws io.spectr.markdown.api.QuerySyntaxException if the selector is malformed
     */
    public static Selector compile(String selector) {
        return SelectorParser.parse(selector);
    }

    public List<Step> steps() {
        return steps;
    }

    public List<Combinator> combinators() {
        return combinators;
    }

    @Override
    public boolean test(NodeHandle node) {
        return matches(node, steps.size() - 1);
    }

    private boolean matches(NodeHandle node, int index) {
        if (!matchesStep(node, steps.get(index))) {
            return false;
        }
        if (index == 0) {
            return true;
        }
        Optional<NodeHandle> parent = node.scopeParent();
        if (combinators.get(index - 1) == Combinator.CHILD) {
            return parent.isPresent() && matches(parent.get(), index - 1);
        }
        while (parent.isPresent()) {
            if (matches(parent.get(), index - 1)) {
                return true;
            }
            parent = parent.get().scopeParent();
        }
        return false;
    }

    private static boolean matchesStep(NodeHandle node, Step step) {
        if (!step.kinds().contains(node.kind())) {
            return false;
        }
        if (step.level() > 0 && node.level() != step.level()) {
            return false;
        }
        for (Condition condition : step.conditions()) {
            if (!holds(node, condition)) {
                return false;
            }
        }
        return true;
    }

    private static boolean holds(NodeHandle node, Condition condition) {
        Object value = value(node, condition.attribute());
        if (value == null) {
            return false;
        }
        Object literal = condition.literal();
        switch (condition.operator()) {
            case EQUALS:
                return same(value, literal);
            case NOT_EQUALS:
                return !same(value, literal);
            case PREFIX:
                return value.toString().startsWith(literal.toString());
            case SUFFIX:
                return value.toString().endsWith(literal.toString());
            case CONTAINS:
                return value.toString().contains(literal.toString());
            case MATCHES:
                return condition.pattern().matcher(value.toString()).find();
            case GREATER:
            case GREATER_EQUALS:
            case LESS:
            case LESS_EQUALS:
                return compares(value, literal, condition.operator());
            default:
                throw new IllegalStateException("unhandled operator " + condition.operator());
        }
    }

    private static boolean same(Object value, Object literal) {
        if (value instanceof Integer i && literal instanceof Long l) {
            return i.longValue() == l;
        }
        if (value instanceof Boolean || literal instanceof Boolean) {
            return value.equals(literal);
        }
        return value.toString().equals(literal.toString());
    }

    // only numeric attributes are ordered
    private static boolean compares(Object value, Object literal, Operator operator) {
        if (!(value instanceof Integer) || !(literal instanceof Long)) {
            return false;
        }
        int c = Long.compare(((Integer) value).longValue(), (Long) literal);
        switch (operator) {
            case GREATER:
                return c > 0;
            case GREATER_EQUALS:
                return c >= 0;
            case LESS:
                return c < 0;
            default:
                return c <= 0;
        }
    }

    private static Object value(NodeHandle node, Attribute attribute) {
        NodeKind kind = node.kind();
        switch (attribute) {
            case LEVEL:
                return kind == NodeKind.HEADER ? (Object) node.level() : null;
            case TEXT:
                return node.text();
            case LANG:
                return kind == NodeKind.CODE_BLOCK ? node.lang() : null;
            case CONTENT:
                return kind == NodeKind.CODE_BLOCK || kind == NodeKind.CODE_SPAN ? node.content() : null;
            case TARGET:
                return kind == NodeKind.WIKI_LINK ? node.target() : null;
            case ID:
                return kind == NodeKind.TASK_ITEM ? node.taskId() : null;
            case CHECKED:
                return kind == NodeKind.TASK_ITEM ? (Object) node.checked() : null;
            case ORDERED:
                return kind == NodeKind.LIST ? (Object) node.ordered() : null;
            case DESCRIPTION:
                return kind == NodeKind.TASK_ITEM ? node.description() : null;
            default:
                throw new IllegalStateException("unhandled attribute " + attribute);
        }
    }

    @Override
    public String toString() {
        return source;
    }
}
