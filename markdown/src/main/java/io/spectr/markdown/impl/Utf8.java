package io.spectr.markdown.impl;

import io.spectr.markdown.api.EncodingException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * UTF-8 well-formedness checks.
 */
public final class Utf8 {
    private Utf8() {}

    /**
     * Verifies that {@code bytes} is well-formed UTF-8.
     *
     * @throws EncodingException carrying the offset of the first malformed sequence
     */
    public static void validate(byte[] bytes) throws EncodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(bytes);
        CharBuffer out = CharBuffer.allocate(4096);
        while (true) {
            CoderResult result = decoder.decode(in, out, true);
            if (result.isError()) {
                throw EncodingException.malformed(in.position(), result.length());
            }
            if (!result.isOverflow()) {
                break;
            }
            out.clear();
        }
        while (decoder.flush(out).isOverflow()) {
            out.clear();
        }
    }

    /** Whether {@code offset} falls between two characters of well-formed UTF-8 {@code bytes}. */
    public static boolean isBoundary(byte[] bytes, int offset) {
        return offset == 0 || offset == bytes.length || (bytes[offset] & 0xC0) != 0x80;
    }
}
