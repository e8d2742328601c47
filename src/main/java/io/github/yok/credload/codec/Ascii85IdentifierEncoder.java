package io.github.yok.credload.codec;

import io.github.yok.credload.util.Ascii85;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

/**
 * Decodes the hex digest to raw bytes and re-encodes them as ASCII85.
 *
 * <p>
 * A 20-byte SHA-1 digest shrinks from 40 hex characters to at most 25 characters. Hex input is
 * accepted in either case. After encoding, the result must be representable in the destination
 * character set; a violation is reported like a decode failure, so only the offending line is
 * skipped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class Ascii85IdentifierEncoder implements IdentifierEncoder {

    private final Charset destinationCharset;

    /**
     * Creates an encoder validating against US-ASCII.
     */
    public Ascii85IdentifierEncoder() {
        this(StandardCharsets.US_ASCII);
    }

    /**
     * Creates an encoder validating against the given character set.
     *
     * @param destinationCharset character set of the identifier column
     */
    public Ascii85IdentifierEncoder(Charset destinationCharset) {
        this.destinationCharset = destinationCharset;
    }

    @Override
    public String encode(String key) throws IdentifierEncodingException {
        byte[] raw;
        try {
            raw = Hex.decodeHex(key);
        } catch (DecoderException e) {
            throw new IdentifierEncodingException("Not a hex digest: " + key, e);
        }

        String encoded = Ascii85.encode(raw);
        if (!destinationCharset.newEncoder().canEncode(encoded)) {
            log.warn("Encoded identifier is not valid {} text: {}", destinationCharset, encoded);
            throw new IdentifierEncodingException(
                    "Encoded identifier is not valid " + destinationCharset + " text");
        }
        return encoded;
    }
}
