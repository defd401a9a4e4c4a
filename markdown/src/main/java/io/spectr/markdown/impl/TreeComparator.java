package io.spectr.markdown.impl;

import io.spectr.markdown.api.Document;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.Arrays;
import java.util.Objects;

/**
 * Structural equality of two document trees, independent of arena ids.
 */
public final class TreeComparator {
    private TreeComparator() {}

    public static boolean equal(Document a, Document b) {
        if (a.length() != b.length() || !Arrays.equals(a.printBytes(), b.printBytes())) {
            return false;
        }
        return firstDifference(a, b) == null;
    }

    /**
     * Describes the first node at which the trees differ, or returns {@code null} when they are
     * structurally equal. Printed bytes are not compared.
     */
    public static String firstDifference(Document a, Document b) {
        NodeArena x = DocumentAccess.arenaOf(a);
        NodeArena y = DocumentAccess.arenaOf(b);
        IntArrayList pending = new IntArrayList();
        pending.add(a.rootId());
        pending.add(b.rootId());
        while (!pending.isEmpty()) {
            int j = pending.popInt();
            int i = pending.popInt();
            if (x.kind(i) != y.kind(j) || x.start(i) != y.start(j) || x.end(i) != y.end(j)) {
                return describe(x, i) + " <> " + describe(y, j);
            }
            if (!sameAttributes(a, i, b, j)) {
                return describe(x, i) + " " + x.attributes(i) + " <> " + y.attributes(j);
            }
            int[] ki = x.children(i);
            int[] kj = y.children(j);
            if (ki.length != kj.length) {
                return describe(x, i) + " has " + ki.length + " children <> " + kj.length;
            }
            for (int k = ki.length - 1; k >= 0; k--) {
                pending.add(ki[k]);
                pending.add(kj[k]);
            }
        }
        return null;
    }

    private static boolean sameAttributes(Document a, int i, Document b, int j) {
        Object x = DocumentAccess.arenaOf(a).attributes(i);
        Object y = DocumentAccess.arenaOf(b).attributes(j);
        if (x instanceof NodeAttributes.Task tx && y instanceof NodeAttributes.Task ty) {
            return tx.withChecked(a.isChecked(i)).equals(ty.withChecked(b.isChecked(j)));
        }
        return Objects.equals(x, y);
    }

    private static String describe(NodeArena arena, int id) {
        return arena.kind(id) + "[" + arena.start(id) + "," + arena.end(id) + ")";
    }
}
