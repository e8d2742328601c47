package io.github.yok.credload.codec;

import java.util.Locale;

/**
 * Stores the hex digest as is, case-folded to lowercase.
 *
 * <p>
 * The input is trusted to be hex of a fixed width; nothing is validated here.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class LowercaseHexIdentifierEncoder implements IdentifierEncoder {

    @Override
    public String encode(String key) {
        return key.toLowerCase(Locale.ROOT);
    }
}
