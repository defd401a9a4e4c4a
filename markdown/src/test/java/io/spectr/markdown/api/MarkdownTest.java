package io.spectr.markdown.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.spectr.markdown.impl.DocumentAccess;
import io.spectr.markdown.impl.NodeArena;
import java.io.IOException;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class MarkdownTest {

    private static final String TASKS = String.join("\n",
        "# Title",
        "",
        "Intro text.",
        "",
        "- [ ] 1.1 First",
        "- [x] 1.2 Second",
        "  details",
        "",
        "```go",
        "fmt.Println()",
        "```",
        "");

    private static List<NodeKind> kinds(List<NodeHandle> nodes) {
        List<NodeKind> kinds = new ArrayList<>();
        for (NodeHandle n : nodes) {
            kinds.add(n.kind());
        }
        return kinds;
    }

    static List<NodeHandle> leaves(Document doc) {
        List<NodeHandle> leaves = new ArrayList<>();
        doc.visit(new Visitor() {
            @Override
            public VisitResult visitNode(NodeHandle node) {
                if (node.childCount() == 0) {
                    leaves.add(node);
                }
                return VisitResult.CONTINUE;
            }
        });
        return leaves;
    }

    @Test
    void topLevelStructure() {
        Document doc = Markdown.parse(TASKS);
        assertEquals(
            List.of(NodeKind.HEADER, NodeKind.PARAGRAPH, NodeKind.LIST, NodeKind.CODE_BLOCK),
            kinds(doc.root().contentChildren()));
    }

    @Test
    void taskAttributes() {
        Document doc = Markdown.parse(TASKS);
        NodeHandle list = doc.root().contentChildren().get(2);
        List<NodeHandle> items = list.contentChildren();
        assertEquals(2, items.size());

        NodeHandle first = items.get(0);
        assertEquals(NodeKind.TASK_ITEM, first.kind());
        assertEquals("1.1", first.taskId());
        assertFalse(first.checked());
        assertEquals("First", first.description());

        NodeHandle second = items.get(1);
        assertEquals("1.2", second.taskId());
        assertTrue(second.checked());
        assertEquals("Second", second.description());
        assertEquals("Second\n  details", second.contentChildren().get(0).text());
    }

    @Test
    void codeBlockAttributes() {
        Document doc = Markdown.parse(TASKS);
        NodeHandle code = doc.root().contentChildren().get(3);
        assertEquals("go", code.lang());
        assertEquals("go", code.info());
        assertEquals("fmt.Println()\n", code.content());
        assertTrue(code.isLeaf());
    }

    @Test
    void headerTextDropsClosingHashes() {
        NodeHandle header = Markdown.parse("## Requirements ##\n").root().contentChildren().get(0);
        assertEquals(2, header.level());
        assertEquals("Requirements", header.text());
    }

    @Test
    void nestedLists() {
        Document doc = Markdown.parse("- a\n  - b\n    - c\n- d\n");
        List<NodeHandle> top = doc.root().contentChildren();
        assertEquals(1, top.size());
        List<NodeHandle> items = top.get(0).contentChildren();
        assertEquals(2, items.size());
        assertEquals("d", items.get(1).text());

        NodeHandle b = items.get(0).contentChildren().get(1).contentChildren().get(0);
        assertEquals(NodeKind.LIST_ITEM, b.kind());
        NodeHandle c = b.contentChildren().get(1).contentChildren().get(0);
        assertEquals("c", c.text());
        assertEquals(b, c.parent().orElseThrow().parent().orElseThrow());
    }

    @Test
    void listKindChangeStartsNewList() {
        List<NodeHandle> lists = Markdown.parse("- a\n1. b\n2) c\n").root().contentChildren();
        assertEquals(2, lists.size());
        assertFalse(lists.get(0).ordered());
        assertTrue(lists.get(1).ordered());
        assertEquals(2, lists.get(1).contentChildren().size());
    }

    @Test
    void inlineNodes() {
        NodeHandle para = Markdown.parse("a *b* and **c** `d` [[auth|Auth spec#login]]\n")
            .root().contentChildren().get(0);
        assertEquals(
            List.of(NodeKind.TEXT, NodeKind.EMPHASIS, NodeKind.TEXT, NodeKind.STRONG, NodeKind.TEXT,
                NodeKind.CODE_SPAN, NodeKind.TEXT, NodeKind.WIKI_LINK),
            kinds(para.contentChildren()));
        NodeHandle link = para.contentChildren().get(7);
        assertEquals("auth", link.target());
        assertEquals("Auth spec", link.display());
        assertEquals("login", link.anchor());
        assertEquals("d", para.contentChildren().get(5).content());
        assertEquals("a b and c d Auth spec", para.text());
    }

    @Test
    void unclosedInlineSyntaxIsText() {
        NodeHandle para = Markdown.parse("a *b `c [[d\n").root().contentChildren().get(0);
        assertEquals(List.of(NodeKind.TEXT), kinds(para.contentChildren()));
    }

    @Test
    void wikilinkDoesNotSpanLines() {
        NodeHandle para = Markdown.parse("[[a\nb]]\n").root().contentChildren().get(0);
        assertEquals(List.of(NodeKind.TEXT), kinds(para.contentChildren()));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "\n\n\n",
        "plain",
        "# H\r\n\r\ntext\r\n",
        "- [ ] 1 a\n  - [x] 1.1 b\n\n    para\n",
        "```\nunterminated fence\n",
        "* a\n+ b\n- c\n",
        "  indented\n\tpara\n",
        "héllo *wörld* [[ünïcode]]\n",
        "> not a quote\n---\n| a | b |\n",
    })
    void printReproducesInput(String text) {
        Document doc = Markdown.parse(text);
        assertEquals(text, doc.print());
        assertArrayEquals(text.getBytes(StandardCharsets.UTF_8), doc.printBytes());
    }

    @ParameterizedTest
    @ValueSource(strings = {"# T\n\n- [ ] 1 a *b*\n  more\n\n```\nx\n```\n", "a\r\nb\r\n\r\n- c\r\n", ""})
    void leavesCoverInput(String text) {
        Document doc = Markdown.parse(text);
        int expected = 0;
        for (NodeHandle leaf : leaves(doc)) {
            assertEquals(expected, leaf.start(), "gap before " + leaf);
            expected = leaf.end();
        }
        assertEquals(doc.length(), expected);
    }

    @Test
    void invalidUtf8IsRejected() {
        byte[] bytes = {'o', 'k', (byte) 0xC3, '(', '\n'};
        EncodingException e = assertThrows(EncodingException.class, () -> Markdown.parse(bytes));
        assertEquals(2, e.getOffset());
        assertEquals("ENCODING", e.getErrorCode());
        assertTrue(e.getMessage().endsWith("[Context: offset 2] [Error Code: ENCODING]"), e.getMessage());
    }

    @Test
    void parseCopiesInput() throws EncodingException {
        byte[] bytes = "# a\n".getBytes(StandardCharsets.UTF_8);
        Document doc = Markdown.parse(bytes);
        bytes[2] = 'b';
        assertEquals("# a\n", doc.print());
    }

    @Test
    void printedBytesAreACopy() {
        Document doc = Markdown.parse("# a\n");
        byte[] printed = doc.printBytes();
        printed[2] = 'b';
        assertEquals("# a\n", doc.print());
        assertEquals("a", doc.root().child(0).text());
    }

    @Test
    void documentExposesNoInternals() {
        assertEquals(0, Document.class.getConstructors().length);
        for (Method method : Document.class.getMethods()) {
            assertFalse(method.getReturnType() == NodeArena.class, method.toString());
        }
        Markdown.parse("x\n");
        assertThrows(IllegalStateException.class, () -> DocumentAccess.install(null));
    }

    @Test
    void readFile(@TempDir Path dir) throws IOException, EncodingException {
        Path file = dir.resolve("spec.md");
        Files.writeString(file, "## Requirements\n");
        Document doc = Markdown.read(file);
        assertEquals("Requirements", doc.query("h2").first().orElseThrow().text());
    }

    @Test
    void lineNumbers() {
        Document doc = Markdown.parse(TASKS);
        assertEquals(1, doc.root().contentChildren().get(0).line());
        assertEquals(5, doc.root().contentChildren().get(2).line());
        assertEquals(9, doc.root().contentChildren().get(3).line());
    }

    @Test
    void nodeLookup() {
        Document doc = Markdown.parse("text\n");
        assertThrows(IllegalArgumentException.class, () -> doc.node(1000));
        assertTrue(doc.root().parent().isEmpty());
        assertNull(doc.root().taskId());
    }

    @Test
    void structuralEquality() {
        assertTrue(Markdown.parse(TASKS).structurallyEquals(Markdown.parse(TASKS)));
        assertFalse(Markdown.parse(TASKS).structurallyEquals(Markdown.parse(TASKS.replace("First", "Frist"))));
    }

    @Test
    void dumpShowsKindsAndSpans() {
        String dump = Markdown.parse("# T\n").dump();
        assertTrue(dump.startsWith("DOCUMENT [0, 4)"), dump);
        assertTrue(dump.contains("HEADER [0, 4)"), dump);
    }
}
