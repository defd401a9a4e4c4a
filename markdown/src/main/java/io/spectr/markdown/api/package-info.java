/**
 * Public API of the spectr markdown engine.
 *
 * <p>The engine understands a small markdown dialect used by spec and change proposal
 * documents: ATX headers, fenced code blocks, ordered and unordered lists, task items with
 * {@code [ ]}/{@code [x]} checkboxes and dotted numeric ids, wikilinks, code spans and
 * emphasis. Everything else is kept as text.
 *
 * <h2>Parsing and printing</h2>
 *
 * <pre>{@code
 * Document doc = Markdown.parse(text);
 * assert doc.print().equals(text);
 * }</pre>
 *
 * <p>Parsing is lossless: every input byte belongs to exactly one leaf of the tree, syntax bytes
 * such as markers, indentation and blank lines included ({@link NodeKind#TRIVIA}). Offsets are
 * UTF-8 byte offsets; {@link LineIndex} converts them to lines and columns.
 *
 * <h2>Editing</h2>
 *
 * <p>Documents are immutable. {@link Document#withTaskChecked} flips one checkbox and prints
 * with exactly that byte changed. {@link Markdown#update} applies a text edit, re-parsing only
 * the affected top-level blocks; the result is structurally equal to a full parse of the edited
 * text.
 *
 * <h2>Traversal and queries</h2>
 *
 * <p>{@link Document#visit} walks the tree in pre-order with per-kind callbacks.
 * {@link Document#query} selects nodes with a CSS-like selector:
 *
 * <pre>{@code
 * doc.query("h2[text*=\"ADDED Requirements\"] h3[text^=\"Requirement:\"]")
 *    .forEach(h -> System.out.println(h.text()));
 * }</pre>
 *
 * <p>Header sections act as ancestors in selectors: a top-level block is nested under the
 * closest preceding header of a lower level.
 *
 * <h2>Thread safety</h2>
 *
 * <p>Parsing keeps no shared state. A built document may be read concurrently.
 */
package io.spectr.markdown.api;
