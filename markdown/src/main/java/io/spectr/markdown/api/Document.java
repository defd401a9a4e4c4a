package io.spectr.markdown.api;

import io.spectr.markdown.impl.DocumentAccess;
import io.spectr.markdown.impl.NodeArena;
import io.spectr.markdown.impl.NodeAttributes;
import io.spectr.markdown.impl.NormalizingPrinter;
import io.spectr.markdown.impl.PositionLookup;
import io.spectr.markdown.impl.ScopeIndex;
import io.spectr.markdown.impl.SourcePrinter;
import io.spectr.markdown.impl.TreeComparator;
import io.spectr.markdown.impl.TreeDumper;
import io.spectr.markdown.query.Selector;
import it.unimi.dsi.fastutil.ints.Int2BooleanMap;
import it.unimi.dsi.fastutil.ints.Int2BooleanMaps;
import it.unimi.dsi.fastutil.ints.Int2BooleanOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * An immutable parsed markdown document.
 *
 * <p>A document owns its source bytes and the arena holding its tree. Operations that look like
 * mutations ({@link #withTaskChecked}, {@link Markdown#update}) return a new document and leave
 * this one untouched, so a document may be read from any number of threads.
 *
 * <p>Checkbox toggles are recorded as overrides and applied while printing: the printed bytes
 * differ from the source in exactly the state byte of each toggled task.
 */
public final class Document {
    private final byte[] source;
    private final NodeArena arena;
    private final int root;
    private final Int2BooleanMap checkedOverrides;

    private volatile LineIndex lineIndex;
    private volatile ScopeIndex scopeIndex;

    static {
        DocumentAccess.install(new DocumentAccess() {
            @Override
            protected NodeArena arena(Document doc) {
                return doc.arena;
            }

            @Override
            protected byte[] source(Document doc) {
                return doc.source;
            }

            @Override
            protected Document create(byte[] source, NodeArena arena, int root) {
                return new Document(source, arena, root);
            }
        });
    }

    // the arena and source must not be modified afterwards
    Document(byte[] source, NodeArena arena, int root) {
        this(source, arena, root, Int2BooleanMaps.EMPTY_MAP);
    }

    private Document(byte[] source, NodeArena arena, int root, Int2BooleanMap checkedOverrides) {
        this.source = source;
        this.arena = arena;
        this.root = root;
        this.checkedOverrides = checkedOverrides;
    }

    public NodeHandle root() {
        return new NodeHandle(this, root);
    }

    public int rootId() {
        return root;
    }

    /**
     * Returns a handle for an arena id of this document.
     *
     * @throws IllegalArgumentException if the id does not denote a live node
     */
    public NodeHandle node(int id) {
        if (!arena.isLive(id)) {
            throw new IllegalArgumentException("No node with id " + id);
        }
        return new NodeHandle(this, id);
    }

    /** Length of the document text in bytes. */
    public int length() {
        return source.length;
    }

    /** The printed text of the document. Identical to the parsed text unless tasks were toggled. */
    public String print() {
        return new String(printBytes(), StandardCharsets.UTF_8);
    }

    /** The printed text as UTF-8. Every call returns a fresh array. */
    public byte[] printBytes() {
        return printBytes(root);
    }

    /** The printed bytes of one subtree. */
    public byte[] printBytes(int id) {
        return SourcePrinter.print(this, id);
    }

    /**
     * Renders the document in canonical form: ATX headers with a single space, {@code -} bullets,
     * ordered items renumbered from 1, {@code - [ ]} checkboxes, backtick fences and a single
     * blank line between blocks.
     */
    public String printNormalized() {
        return NormalizingPrinter.print(this);
    }

    /**
     * Walks the tree in pre-order, calling the visitor method matching each node's kind.
     */
    public void visit(Visitor visitor) {
        IntArrayList pending = new IntArrayList();
        pending.add(root);
        while (!pending.isEmpty()) {
            int id = pending.popInt();
            NodeHandle node = new NodeHandle(this, id);
            VisitResult result = dispatch(visitor, node);
            if (result == VisitResult.STOP) {
                return;
            }
            if (result == VisitResult.CONTINUE) {
                int[] kids = arena.children(id);
                for (int i = kids.length - 1; i >= 0; i--) {
                    pending.add(kids[i]);
                }
            }
        }
    }

    private static VisitResult dispatch(Visitor visitor, NodeHandle node) {
        switch (node.kind()) {
            case DOCUMENT:
                return visitor.visitDocument(node);
            case HEADER:
                return visitor.visitHeader(node);
            case PARAGRAPH:
                return visitor.visitParagraph(node);
            case CODE_BLOCK:
                return visitor.visitCodeBlock(node);
            case LIST:
                return visitor.visitList(node);
            case LIST_ITEM:
                return visitor.visitListItem(node);
            case TASK_ITEM:
                return visitor.visitTaskItem(node);
            case TEXT:
                return visitor.visitText(node);
            case WIKI_LINK:
                return visitor.visitWikiLink(node);
            case EMPHASIS:
                return visitor.visitEmphasis(node);
            case STRONG:
                return visitor.visitStrong(node);
            case CODE_SPAN:
                return visitor.visitCodeSpan(node);
            case TRIVIA:
                return visitor.visitTrivia(node);
            default:
                throw new IllegalStateException("unhandled kind " + node.kind());
        }
    }

    /**
     * Compiles {@code selector} and returns the lazy sequence of matching nodes.
     *
     * @throws QuerySyntaxException if the selector is malformed
     */
    public Query query(String selector) {
        return new Query(this, Selector.compile(selector));
    }

    /**
     * The innermost node containing the byte {@code offset}. Since the leaves cover the whole
     * text this is always a leaf, possibly trivia. Empty when the offset is outside
     * {@code [0, length())}.
     */
    public Optional<NodeHandle> nodeAt(int offset) {
        IntArrayList path = PositionLookup.path(arena, root, offset);
        return path.isEmpty() ? Optional.empty() : Optional.of(new NodeHandle(this, path.topInt()));
    }

    /** Every node containing {@code offset}, from the document node down to the leaf. */
    public List<NodeHandle> nodesAt(int offset) {
        return handles(PositionLookup.path(arena, root, offset));
    }

    /** Every node whose span overlaps {@code range}, in document order. */
    public List<NodeHandle> nodesInRange(ByteRange range) {
        return handles(PositionLookup.overlapping(arena, root, range.start(), range.end()));
    }

    /**
     * The headers whose sections contain {@code offset}, outermost first. A header's section runs
     * from the header to the next top-level header of the same or a lower level.
     */
    public List<NodeHandle> sectionsAt(int offset) {
        IntArrayList path = PositionLookup.path(arena, root, offset);
        if (path.size() < 2) {
            return Collections.emptyList();
        }
        int top = path.getInt(1);
        int header = arena.kind(top) == NodeKind.HEADER ? top : scopeParent(top);
        List<NodeHandle> out = new ArrayList<>();
        while (header >= 0 && header != root) {
            out.add(new NodeHandle(this, header));
            header = scopeParent(header);
        }
        Collections.reverse(out);
        return out;
    }

    /** The header of the innermost section containing {@code offset}. */
    public Optional<NodeHandle> enclosingSection(int offset) {
        List<NodeHandle> sections = sectionsAt(offset);
        return sections.isEmpty() ? Optional.empty() : Optional.of(sections.get(sections.size() - 1));
    }

    private List<NodeHandle> handles(IntArrayList ids) {
        List<NodeHandle> out = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            out.add(new NodeHandle(this, ids.getInt(i)));
        }
        return out;
    }

    /**
     * Returns a document whose task {@code task} has the given checkbox state.
     *
     * @throws IllegalArgumentException if {@code task} is not a task item of this document
     */
    public Document withTaskChecked(NodeHandle task, boolean checked) {
        if (task.document() != this || task.kind() != NodeKind.TASK_ITEM) {
            throw new IllegalArgumentException("Not a task item of this document: " + task);
        }
        if (isChecked(task.id()) == checked) {
            return this;
        }
        Int2BooleanOpenHashMap overrides = new Int2BooleanOpenHashMap(checkedOverrides);
        boolean parsed = ((NodeAttributes.Task) arena.attributes(task.id())).checked();
        if (parsed == checked) {
            overrides.remove(task.id());
        } else {
            overrides.put(task.id(), checked);
        }
        return new Document(source, arena, root, Int2BooleanMaps.unmodifiable(overrides));
    }

    /** Checkbox state of the task {@code id}, including toggles. {@code false} for other nodes. */
    public boolean isChecked(int id) {
        if (checkedOverrides.containsKey(id)) {
            return checkedOverrides.get(id);
        }
        return arena.attributes(id) instanceof NodeAttributes.Task t && t.checked();
    }

    /** Checkbox toggles applied on top of the parsed source, keyed by task id. */
    public Int2BooleanMap checkedOverrides() {
        return checkedOverrides;
    }

    public LineIndex lineIndex() {
        LineIndex index = lineIndex;
        if (index == null) {
            index = LineIndex.of(source);
            lineIndex = index;
        }
        return index;
    }

    int scopeParent(int id) {
        ScopeIndex index = scopeIndex;
        if (index == null) {
            index = ScopeIndex.build(arena, root);
            scopeIndex = index;
        }
        return index.parentOf(id);
    }

    /**
     * Whether both documents print the same bytes and have trees of identical shape, kinds,
     * spans and attributes. Arena ids are not compared.
     */
    public boolean structurallyEquals(Document other) {
        return TreeComparator.equal(this, other);
    }

    /** Indented dump of the tree, one node per line, for diagnostics and tests. */
    public String dump() {
        return TreeDumper.dump(this);
    }

    NodeArena arena() {
        return arena;
    }

    @Override
    public String toString() {
        return "Document[" + source.length + " bytes, " + arena.liveCount() + " nodes]";
    }
}
