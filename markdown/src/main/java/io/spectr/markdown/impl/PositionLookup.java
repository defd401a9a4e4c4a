package io.spectr.markdown.impl;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Offset queries over a tree whose child spans are contiguous and sorted, so each level is
 * searched by bisection.
 */
public final class PositionLookup {
    private PositionLookup() {}

    /**
     * Ids of the nodes whose span contains {@code offset}, from the root down to the innermost
     * leaf. Empty when the offset lies outside the root span.
     */
    public static IntArrayList path(NodeArena arena, int root, int offset) {
        IntArrayList path = new IntArrayList();
        if (!contains(arena, root, offset)) {
            return path;
        }
        int node = root;
        while (node >= 0) {
            path.add(node);
            node = childContaining(arena, node, offset);
        }
        return path;
    }

    /**
     * Ids of the nodes whose span overlaps {@code [start, end)}, in pre-order. Empty nodes never
     * overlap.
     */
    public static IntArrayList overlapping(NodeArena arena, int root, int start, int end) {
        IntArrayList out = new IntArrayList();
        if (start >= end) {
            return out;
        }
        IntArrayList pending = new IntArrayList();
        pending.add(root);
        while (!pending.isEmpty()) {
            int id = pending.popInt();
            if (arena.start(id) >= end || arena.end(id) <= start) {
                continue;
            }
            out.add(id);
            int[] kids = arena.children(id);
            for (int i = kids.length - 1; i >= 0; i--) {
                pending.add(kids[i]);
            }
        }
        return out;
    }

    private static boolean contains(NodeArena arena, int id, int offset) {
        return offset >= arena.start(id) && offset < arena.end(id);
    }

    // -1 when no child contains the offset
    private static int childContaining(NodeArena arena, int parent, int offset) {
        int[] kids = arena.children(parent);
        int lo = 0;
        int hi = kids.length - 1;
        int candidate = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (arena.start(kids[mid]) <= offset) {
                candidate = kids[mid];
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return candidate >= 0 && contains(arena, candidate, offset) ? candidate : -1;
    }
}
