package io.spectr.markdown.impl;

import io.spectr.markdown.api.NodeKind;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Section hierarchy over the flat sequence of top-level blocks.
 *
 * <p>ATX headers do not nest in the tree, so a top-level node's scope parent is the closest
 * preceding top-level header of a lower level (any header for non-header nodes), falling back
 * to the document. Nested nodes keep their tree parent.
 */
public final class ScopeIndex {
    private final NodeArena arena;
    private final int root;
    private final Int2IntOpenHashMap topLevel;

    private ScopeIndex(NodeArena arena, int root, Int2IntOpenHashMap topLevel) {
        this.arena = arena;
        this.root = root;
        this.topLevel = topLevel;
    }

    public static ScopeIndex build(NodeArena arena, int root) {
        Int2IntOpenHashMap parents = new Int2IntOpenHashMap();
        IntArrayList headers = new IntArrayList();
        for (int id : arena.children(root)) {
            if (arena.kind(id) == NodeKind.HEADER) {
                int level = ((NodeAttributes.Heading) arena.attributes(id)).level();
                while (!headers.isEmpty() && levelOf(arena, headers.topInt()) >= level) {
                    headers.popInt();
                }
                parents.put(id, headers.isEmpty() ? root : headers.topInt());
                headers.add(id);
            } else {
                parents.put(id, headers.isEmpty() ? root : headers.topInt());
            }
        }
        return new ScopeIndex(arena, root, parents);
    }

    private static int levelOf(NodeArena arena, int header) {
        return ((NodeAttributes.Heading) arena.attributes(header)).level();
    }

    /** Scope parent of {@code id}, or -1 for the document node. */
    public int parentOf(int id) {
        if (id == root) {
            return -1;
        }
        int parent = arena.parent(id);
        return parent == root ? topLevel.get(id) : parent;
    }
}
