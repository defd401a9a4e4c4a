package io.spectr.markdown.api;

import io.spectr.markdown.impl.BlockParser;
import io.spectr.markdown.impl.IncrementalUpdater;
import io.spectr.markdown.impl.NodeArena;
import io.spectr.markdown.impl.Utf8;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points of the markdown engine.
 *
 * <p>Parsing never fails on markdown content: constructs outside the supported dialect are kept
 * as text. The only parse failure is input that is not well-formed UTF-8.
 */
public final class Markdown {
    private static final Logger log = LoggerFactory.getLogger(Markdown.class);

    private Markdown() {}

    /**
     * Parses a document from text.
     */
    public static Document parse(String text) {
        return build(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Parses a document from UTF-8 bytes. The array is copied.
     *
     * @throws EncodingException if {@code bytes} is not well-formed UTF-8
     */
    public static Document parse(byte[] bytes) throws EncodingException {
        Utf8.validate(bytes);
        return build(bytes.clone());
    }

    /**
     * Reads and parses a file.
     *
     * @throws IOException if the file cannot be read
     * @throws EncodingException if the file is not well-formed UTF-8
     */
    public static Document read(Path path) throws IOException, EncodingException {
        byte[] bytes = Files.readAllBytes(path);
        Utf8.validate(bytes);
        return build(bytes);
    }

    /**
     * Replaces the bytes {@code edit} of the printed text of {@code prev} with {@code newText}
     * and returns the resulting document. Top-level nodes outside the re-parsed region keep
     * their arena ids.
     *
     * @throws IncrementalMismatchException if the range is inverted, outside the document or
     *     splits a UTF-8 sequence
     */
    public static Document update(Document prev, ByteRange edit, String newText)
            throws IncrementalMismatchException {
        return IncrementalUpdater.update(prev, edit, newText);
    }

    private static Document build(byte[] bytes) {
        NodeArena arena = new NodeArena(Math.max(64, bytes.length / 8));
        int root = BlockParser.parseDocument(bytes, arena);
        Document doc = new Document(bytes, arena, root);
        log.debug("Parsed {} bytes into {} nodes", bytes.length, arena.liveCount());
        return doc;
    }
}
