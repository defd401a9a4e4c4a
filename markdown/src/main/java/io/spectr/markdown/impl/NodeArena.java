package io.spectr.markdown.impl;

import io.spectr.markdown.api.NodeKind;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.Arrays;

/**
 * Column oriented node storage addressed by {@code int} ids.
 *
 * <p>Each column is a parallel array indexed by node id. Released ids are kept on a free list
 * and handed out again by {@link #allocate}. An arena is filled by exactly one parse; once a
 * document owns it the arena is only read. Incremental updates work on a {@link #copy()}.
 */
public final class NodeArena {
    private static final int[] NO_CHILDREN = new int[0];

    private NodeKind[] kinds;
    private int[] starts;
    private int[] ends;
    private int[] parents;
    private int[][] children;
    private Object[] attributes;
    private int size;
    private final IntArrayList free;

    public NodeArena() {
        this(64);
    }

    public NodeArena(int capacity) {
        int cap = Math.max(capacity, 8);
        this.kinds = new NodeKind[cap];
        this.starts = new int[cap];
        this.ends = new int[cap];
        this.parents = new int[cap];
        this.children = new int[cap][];
        this.attributes = new Object[cap];
        this.free = new IntArrayList();
    }

    private NodeArena(NodeArena other) {
        this.kinds = other.kinds.clone();
        this.starts = other.starts.clone();
        this.ends = other.ends.clone();
        this.parents = other.parents.clone();
        // child arrays are replaced, never written in place, so they can be shared
        this.children = other.children.clone();
        this.attributes = other.attributes.clone();
        this.size = other.size;
        this.free = new IntArrayList(other.free);
    }

    /** Returns an independent arena with the same content and free list. */
    public NodeArena copy() {
        return new NodeArena(this);
    }

    /**
     * Allocates a node, reusing a released id when one is available.
     *
     * @return the id of the new node
     */
    public int allocate(NodeKind kind, int start, int end) {
        int id;
        if (!free.isEmpty()) {
            id = free.popInt();
        } else {
            if (size == kinds.length) {
                grow();
            }
            id = size++;
        }
        kinds[id] = kind;
        starts[id] = start;
        ends[id] = end;
        parents[id] = -1;
        children[id] = NO_CHILDREN;
        attributes[id] = null;
        return id;
    }

    private void grow() {
        int cap = kinds.length * 2;
        kinds = Arrays.copyOf(kinds, cap);
        starts = Arrays.copyOf(starts, cap);
        ends = Arrays.copyOf(ends, cap);
        parents = Arrays.copyOf(parents, cap);
        children = Arrays.copyOf(children, cap);
        attributes = Arrays.copyOf(attributes, cap);
    }

    public void setChildren(int id, IntList kids) {
        setChildren(id, kids.toIntArray());
    }

    public void setChildren(int id, int[] kids) {
        children[id] = kids.length == 0 ? NO_CHILDREN : kids;
        for (int kid : kids) {
            parents[kid] = id;
        }
    }

    public void setSpan(int id, int start, int end) {
        starts[id] = start;
        ends[id] = end;
    }

    public void setAttributes(int id, Object value) {
        attributes[id] = value;
    }

    /**
     * Returns all ids of the subtree rooted at {@code id} to the free list.
     */
    public void release(int id) {
        IntArrayList pending = new IntArrayList();
        pending.add(id);
        while (!pending.isEmpty()) {
            int n = pending.popInt();
            for (int kid : children[n]) {
                pending.add(kid);
            }
            kinds[n] = null;
            children[n] = NO_CHILDREN;
            attributes[n] = null;
            parents[n] = -1;
            free.add(n);
        }
    }

    /**
     * Moves the spans of the subtree rooted at {@code id} by {@code delta} bytes.
     */
    public void shift(int id, int delta) {
        if (delta == 0) {
            return;
        }
        IntArrayList pending = new IntArrayList();
        pending.add(id);
        while (!pending.isEmpty()) {
            int n = pending.popInt();
            starts[n] += delta;
            ends[n] += delta;
            for (int kid : children[n]) {
                pending.add(kid);
            }
        }
    }

    public boolean isLive(int id) {
        return id >= 0 && id < size && kinds[id] != null;
    }

    public NodeKind kind(int id) {
        return kinds[id];
    }

    public int start(int id) {
        return starts[id];
    }

    public int end(int id) {
        return ends[id];
    }

    public int parent(int id) {
        return parents[id];
    }

    /** Child ids of {@code id}; the returned array must not be modified. */
    public int[] children(int id) {
        return children[id];
    }

    public Object attributes(int id) {
        return attributes[id];
    }

    /** Number of slots handed out so far, live or released. */
    public int size() {
        return size;
    }

    public int freeCount() {
        return free.size();
    }

    public int liveCount() {
        return size - free.size();
    }
}
