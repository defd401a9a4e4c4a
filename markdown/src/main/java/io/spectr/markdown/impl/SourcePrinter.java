package io.spectr.markdown.impl;

import io.spectr.markdown.api.Document;
import it.unimi.dsi.fastutil.ints.Int2BooleanMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.Arrays;

/**
 * Replays the raw spans of a tree's leaves.
 *
 * <p>Untouched leaves are copied verbatim. A leaf that holds the checkbox of a toggled task is
 * copied with only the checkbox state byte replaced, so the output differs from the source in
 * exactly one byte per toggled task.
 */
public final class SourcePrinter {
    private SourcePrinter() {}

    public static byte[] print(Document doc, int id) {
        NodeArena arena = DocumentAccess.arenaOf(doc);
        byte[] src = DocumentAccess.sourceOf(doc);
        int base = arena.start(id);
        byte[] out = new byte[arena.end(id) - base];
        long[] patches = patches(doc);
        int nextPatch = 0;
        int written = 0;

        IntArrayList pending = new IntArrayList();
        pending.add(id);
        while (!pending.isEmpty()) {
            int n = pending.popInt();
            int[] kids = arena.children(n);
            if (kids.length > 0) {
                for (int i = kids.length - 1; i >= 0; i--) {
                    pending.add(kids[i]);
                }
                continue;
            }
            int start = arena.start(n);
            int end = arena.end(n);
            System.arraycopy(src, start, out, written, end - start);
            while (nextPatch < patches.length && offset(patches[nextPatch]) < end) {
                int at = offset(patches[nextPatch]);
                if (at >= start) {
                    out[written + at - start] = (byte) (patches[nextPatch] & 0xff);
                }
                nextPatch++;
            }
            written += end - start;
        }
        return out;
    }

    // offset in the high 32 bits, replacement byte in the low bits, sorted by offset
    private static long[] patches(Document doc) {
        Int2BooleanMap overrides = doc.checkedOverrides();
        if (overrides.isEmpty()) {
            return new long[0];
        }
        NodeArena arena = DocumentAccess.arenaOf(doc);
        long[] patches = new long[overrides.size()];
        int i = 0;
        for (Int2BooleanMap.Entry e : overrides.int2BooleanEntrySet()) {
            int task = e.getIntKey();
            NodeAttributes.Task attrs = (NodeAttributes.Task) arena.attributes(task);
            long offset = arena.start(task) + attrs.markDelta();
            patches[i++] = (offset << 32) | (e.getBooleanValue() ? 'x' : ' ');
        }
        Arrays.sort(patches);
        return patches;
    }

    private static int offset(long patch) {
        return (int) (patch >>> 32);
    }
}
