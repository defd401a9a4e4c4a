package io.spectr.markdown.impl;

import io.spectr.markdown.api.ByteRange;
import io.spectr.markdown.api.Document;
import io.spectr.markdown.api.IncrementalMismatchException;
import io.spectr.markdown.api.NodeKind;
import it.unimi.dsi.fastutil.ints.Int2BooleanMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a text edit to a document by re-parsing only the affected top-level blocks.
 *
 * <p>The edit is expressed against the printed text of the previous document. Parsing restarts
 * at the top-level block preceding the first block touched by the edit, since that block's open
 * containers decide where the edited lines land. It stops as soon as the new parse is about to
 * open a top-level node at an offset past the edit that, shifted back by the edit delta, is the
 * start of an old top-level node: from there on both parses see the same bytes in the same
 * state. The old suffix is kept with its arena ids and shifted spans.
 *
 * <p>Setting the system property {@value #VERIFY_PROPERTY} to {@code true} compares every
 * result with a full parse and falls back to the full parse on divergence.
 */
public final class IncrementalUpdater {
    public static final String VERIFY_PROPERTY = "spectr.markdown.verifyIncremental";

    private static final Logger log = LoggerFactory.getLogger(IncrementalUpdater.class);

    private IncrementalUpdater() {}

    public static Document update(Document prev, ByteRange edit, String newText)
            throws IncrementalMismatchException {
        byte[] old = prev.printBytes();
        if (edit.start() < 0 || edit.end() < edit.start() || edit.end() > old.length) {
            throw IncrementalMismatchException.outOfBounds(edit, old.length);
        }
        if (!Utf8.isBoundary(old, edit.start())) {
            throw IncrementalMismatchException.splitsCharacter(edit, edit.start());
        }
        if (!Utf8.isBoundary(old, edit.end())) {
            throw IncrementalMismatchException.splitsCharacter(edit, edit.end());
        }
        byte[] inserted = newText.getBytes(StandardCharsets.UTF_8);
        int delta = inserted.length - edit.length();
        byte[] text = new byte[old.length + delta];
        System.arraycopy(old, 0, text, 0, edit.start());
        System.arraycopy(inserted, 0, text, edit.start(), inserted.length);
        System.arraycopy(old, edit.end(), text, edit.start() + inserted.length, old.length - edit.end());
        int newEditEnd = edit.start() + inserted.length;

        NodeArena arena = DocumentAccess.arenaOf(prev).copy();
        materializeOverrides(prev, arena);
        int root = prev.rootId();
        int[] oldChildren = arena.children(root);

        int restart = restartIndex(arena, oldChildren, edit.start());
        int from = restart < oldChildren.length ? arena.start(oldChildren[restart]) : 0;

        Int2IntOpenHashMap oldStarts = new Int2IntOpenHashMap();
        oldStarts.defaultReturnValue(-1);
        for (int i = restart; i < oldChildren.length; i++) {
            oldStarts.put(arena.start(oldChildren[i]), i);
        }
        BlockParser.Blocks blocks = BlockParser.parseBlocks(text, from, arena,
            p -> p >= newEditEnd && oldStarts.containsKey(p - delta));

        int resume = blocks.stoppedAt() < 0 ? oldChildren.length : oldStarts.get(blocks.stoppedAt() - delta);
        for (int i = restart; i < resume; i++) {
            arena.release(oldChildren[i]);
        }
        for (int i = resume; i < oldChildren.length; i++) {
            arena.shift(oldChildren[i], delta);
        }
        int[] fresh = blocks.children();
        IntArrayList children = new IntArrayList(restart + fresh.length + oldChildren.length - resume);
        children.addElements(0, oldChildren, 0, restart);
        children.addElements(children.size(), fresh);
        children.addElements(children.size(), oldChildren, resume, oldChildren.length - resume);
        arena.setChildren(root, children);
        arena.setSpan(root, 0, text.length);

        Document result = DocumentAccess.newDocument(text, arena, root);
        if (log.isDebugEnabled()) {
            log.debug("Re-parsed bytes [{}, {}) into {} top-level nodes, reused {} of {} (delta {})",
                from, blocks.stoppedAt() < 0 ? text.length : blocks.stoppedAt(), fresh.length,
                restart + oldChildren.length - resume, oldChildren.length, delta);
        }
        if (Boolean.getBoolean(VERIFY_PROPERTY)) {
            return verified(result, text);
        }
        return result;
    }

    /**
     * Index of the top-level node from which parsing restarts: the non-trivia sibling preceding
     * the node that contains {@code offset}. An offset on a boundary belongs to the node that
     * ends there.
     */
    static int restartIndex(NodeArena arena, int[] children, int offset) {
        if (children.length == 0) {
            return 0;
        }
        int affected = children.length - 1;
        for (int i = 0; i < children.length; i++) {
            if (arena.end(children[i]) >= offset) {
                affected = i;
                break;
            }
        }
        for (int i = affected - 1; i >= 0; i--) {
            if (arena.kind(children[i]) != NodeKind.TRIVIA) {
                return i;
            }
        }
        return 0;
    }

    private static void materializeOverrides(Document prev, NodeArena arena) {
        for (Int2BooleanMap.Entry e : prev.checkedOverrides().int2BooleanEntrySet()) {
            NodeAttributes.Task task = (NodeAttributes.Task) arena.attributes(e.getIntKey());
            arena.setAttributes(e.getIntKey(), task.withChecked(e.getBooleanValue()));
        }
    }

    private static Document verified(Document incremental, byte[] text) {
        NodeArena arena = new NodeArena(Math.max(64, text.length / 8));
        Document full = DocumentAccess.newDocument(text, arena, BlockParser.parseDocument(text, arena));
        String difference = TreeComparator.firstDifference(incremental, full);
        if (difference != null) {
            log.warn("Incremental update diverged from a full parse at {}; using the full parse", difference);
            return full;
        }
        return incremental;
    }
}
