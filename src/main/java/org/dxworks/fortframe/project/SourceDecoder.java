package org.dxworks.fortframe.project;

import org.dxworks.fortframe.diagnostics.SourceEncodingException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;

/** Strict decoding of source bytes: malformed input is an error, not a replacement character. */
final class SourceDecoder {
    private static final char BOM = '\uFEFF';

    private SourceDecoder() {
        // utility class
    }

    static String decode(String file, byte[] bytes, Charset charset) {
        try {
            String text = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
        } catch (CharacterCodingException e) {
            throw new SourceEncodingException(file, charset.name(), e);
        }
    }
}
