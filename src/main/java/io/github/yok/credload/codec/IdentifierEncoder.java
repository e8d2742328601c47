package io.github.yok.credload.codec;

/**
 * Transforms the raw key field of an input line into the stored identifier.
 *
 * @author Yasuharu.Okawauchi
 */
public interface IdentifierEncoder {

    /**
     * Encodes the key field.
     *
     * @param key key field as read from the input line; never empty
     * @return identifier to store
     * @throws IdentifierEncodingException if the key cannot be encoded; the line is skipped
     */
    String encode(String key) throws IdentifierEncodingException;
}
