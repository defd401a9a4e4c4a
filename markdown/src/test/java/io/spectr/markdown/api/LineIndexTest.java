package io.spectr.markdown.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

public class LineIndexTest {

    private static final LineIndex INDEX = LineIndex.of("ab\r\nc\n\nédf".getBytes(StandardCharsets.UTF_8));

    @Test
    void linesAndColumns() {
        assertEquals(4, INDEX.lineCount());
        assertEquals(new LineIndex.Position(1, 1), INDEX.position(0));
        assertEquals(new LineIndex.Position(1, 3), INDEX.position(2));
        assertEquals(new LineIndex.Position(2, 1), INDEX.position(4));
        assertEquals(new LineIndex.Position(3, 1), INDEX.position(6));
        assertEquals("4:3", INDEX.position(9).toString());
    }

    @Test
    void lineBounds() {
        assertEquals(0, INDEX.lineStart(1));
        assertEquals(2, INDEX.lineEnd(1));
        assertEquals(5, INDEX.lineEnd(2));
        assertEquals(6, INDEX.lineStart(3));
        assertEquals(6, INDEX.lineEnd(3));
        assertEquals(11, INDEX.lineEnd(4));
    }

    @Test
    void offsetClampsToLineEnd() {
        assertEquals(1, INDEX.offset(1, 2));
        assertEquals(2, INDEX.offset(1, 40));
        assertEquals(7, INDEX.offset(4, 0));
    }

    @Test
    void outOfRange() {
        assertThrows(IndexOutOfBoundsException.class, () -> INDEX.position(12));
        assertThrows(IndexOutOfBoundsException.class, () -> INDEX.position(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> INDEX.lineStart(5));
    }
}
