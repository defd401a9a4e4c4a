package io.spectr.markdown.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class DocumentEditingTest {

    private static final String TASKS = "## 1. Setup\n\n- [ ] 1.1 Install\n-  [X]   1.2   Configure  it\n  * nested note\n";

    @Test
    void toggleChangesOneByte() {
        Document doc = Markdown.parse(TASKS);
        NodeHandle install = doc.query("task[id='1.1']").first().orElseThrow();
        Document checked = doc.withTaskChecked(install, true);

        assertEquals(TASKS.replace("- [ ] 1.1", "- [x] 1.1"), checked.print());
        assertEquals(TASKS, doc.print());
        assertTrue(checked.node(install.id()).checked());
        assertFalse(install.checked());
    }

    @Test
    void toggleBackRestoresSource() {
        Document doc = Markdown.parse(TASKS);
        NodeHandle configure = doc.query("task[id='1.2']").first().orElseThrow();
        Document unchecked = doc.withTaskChecked(configure, false);
        assertEquals(TASKS.replace("[X]", "[ ]"), unchecked.print());

        Document again = unchecked.withTaskChecked(unchecked.node(configure.id()), true);
        assertTrue(again.checkedOverrides().isEmpty());
        assertEquals(TASKS, again.print());
    }

    @Test
    void toggleToCurrentStateReturnsSameDocument() {
        Document doc = Markdown.parse(TASKS);
        NodeHandle configure = doc.query("task[checked=true]").first().orElseThrow();
        assertSame(doc, doc.withTaskChecked(configure, true));
    }

    @Test
    void toggleRejectsForeignOrNonTaskNodes() {
        Document doc = Markdown.parse(TASKS);
        Document other = Markdown.parse(TASKS);
        NodeHandle foreign = other.query("task").first().orElseThrow();
        assertThrows(IllegalArgumentException.class, () -> doc.withTaskChecked(foreign, true));
        NodeHandle header = doc.query("h2").first().orElseThrow();
        assertThrows(IllegalArgumentException.class, () -> doc.withTaskChecked(header, true));
    }

    @Test
    void toggledNodePrintsPatchedRaw() {
        Document doc = Markdown.parse(TASKS);
        NodeHandle install = doc.query("task").first().orElseThrow();
        Document checked = doc.withTaskChecked(install, true);
        assertEquals("- [x] 1.1 Install\n", checked.node(install.id()).raw());
    }

    @Test
    void normalizedForm() {
        String messy = "#   Title\n\n\n* one\n* two\n\n3) x\n-  [X]   1.1   Do  it\n";
        String expected = "# Title\n\n- one\n- two\n\n1. x\n\n- [x] 1.1 Do  it\n";
        assertEquals(expected, Markdown.parse(messy).printNormalized());
    }

    @Test
    void normalizedNesting() {
        String text = "- a\n    - b\n\n  para\n1. c\n";
        String normalized = Markdown.parse(text).printNormalized();
        assertEquals("- a\n  - b\n\n  para\n\n1. c\n", normalized);
    }

    @Test
    void normalizedFenceOutgrowsContent() {
        String text = "````md\n```\ninner\n```\n````\n";
        assertEquals(text, Markdown.parse(text).printNormalized());
    }

    @Test
    void normalizedIsStable() {
        String messy = "#  A ##\ntext *em* __strong__ [[t | d # a]]\n\n+ [ ] 1 x\n  + y\n\n```\ncode\n```\n";
        String once = Markdown.parse(messy).printNormalized();
        assertEquals(once, Markdown.parse(once).printNormalized());
    }

    static Stream<Arguments> hashHeaders() {
        return Stream.of(
            Arguments.of("## ## #", "##", "## ## #"),
            Arguments.of("# # #", "#", "# # #"),
            Arguments.of("### a ## ###", "a ##", "### a ## #"),
            Arguments.of("## C#", "C#", "## C#"));
    }

    @ParameterizedTest
    @MethodSource("hashHeaders")
    void headerTextMadeOfHashesSurvivesNormalization(String line, String text, String normalized) {
        String once = Markdown.parse(line + "\n").printNormalized();
        assertEquals(normalized + "\n", once);
        Document reparsed = Markdown.parse(once);
        assertEquals(text, reparsed.root().contentChildren().get(0).text());
        assertEquals(once, reparsed.printNormalized());
    }
}
