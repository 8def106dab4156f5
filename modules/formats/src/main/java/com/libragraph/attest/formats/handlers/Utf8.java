package com.libragraph.attest.formats.handlers;

import com.libragraph.attest.formats.api.SourceParseException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Strict UTF-8 decoding: malformed input is a parse failure, never silently replaced.
 */
final class Utf8 {

    private Utf8() {
    }

    static String decode(byte[] content) throws SourceParseException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new SourceParseException("Content is not valid UTF-8", e);
        }
    }
}
