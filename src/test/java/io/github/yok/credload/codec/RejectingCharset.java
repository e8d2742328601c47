package io.github.yok.credload.codec;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.nio.charset.StandardCharsets;

/**
 * ASCII-like charset whose encoder cannot encode one given character.
 */
public class RejectingCharset extends Charset {

    private final char rejected;

    public RejectingCharset(char rejected) {
        super("x-credload-rejecting", null);
        this.rejected = rejected;
    }

    @Override
    public boolean contains(Charset cs) {
        return false;
    }

    @Override
    public CharsetDecoder newDecoder() {
        return StandardCharsets.US_ASCII.newDecoder();
    }

    @Override
    public CharsetEncoder newEncoder() {
        return new CharsetEncoder(this, 1.0f, 1.0f) {
            @Override
            protected CoderResult encodeLoop(CharBuffer in, ByteBuffer out) {
                while (in.hasRemaining()) {
                    char c = in.get();
                    if (c == rejected || c > 0x7F) {
                        in.position(in.position() - 1);
                        return CoderResult.unmappableForLength(1);
                    }
                    if (!out.hasRemaining()) {
                        in.position(in.position() - 1);
                        return CoderResult.OVERFLOW;
                    }
                    out.put((byte) c);
                }
                return CoderResult.UNDERFLOW;
            }
        };
    }
}
