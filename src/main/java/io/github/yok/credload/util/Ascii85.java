package io.github.yok.credload.util;

import com.google.common.base.Preconditions;
import java.io.ByteArrayOutputStream;
import lombok.Generated;

/**
 * ASCII85 (btoa / Adobe alphabet) codec without the {@code <~ ~>} delimiters.
 *
 * <p>
 * Every 4 input bytes become 5 characters in the range {@code '!'..'u'}. A full group of four zero
 * bytes is written as the single character {@code 'z'}. A trailing group of {@code n} bytes
 * ({@code 1 <= n <= 3}) is zero-padded, encoded, and truncated to {@code n + 1} characters.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class Ascii85 {

    private static final int BASE = 85;
    private static final char OFFSET = '!';
    private static final char ZERO_GROUP = 'z';

    /**
     * Prevents instantiation.
     */
    @Generated
    private Ascii85() {
        throw new AssertionError("No io.github.yok.credload.util.Ascii85 instances for you!");
    }

    /**
     * Returns the maximum number of characters {@link #encode(byte[])} produces for {@code n}
     * bytes.
     *
     * @param n input length in bytes
     * @return upper bound of the encoded length
     */
    public static int maxEncodedLength(int n) {
        return (n + 3) / 4 * 5;
    }

    /**
     * Encodes raw bytes.
     *
     * @param src bytes to encode
     * @return encoded text; empty when {@code src} is empty
     * @throws NullPointerException if {@code src} is {@code null}
     */
    public static String encode(byte[] src) {
        Preconditions.checkNotNull(src, "src must not be null");
        StringBuilder out = new StringBuilder(maxEncodedLength(src.length));
        char[] group = new char[5];

        for (int pos = 0; pos < src.length; pos += 4) {
            int n = Math.min(4, src.length - pos);
            long word = 0;
            for (int i = 0; i < 4; i++) {
                int b = i < n ? src[pos + i] & 0xFF : 0;
                word = (word << 8) | b;
            }

            if (word == 0 && n == 4) {
                out.append(ZERO_GROUP);
                continue;
            }

            for (int i = 4; i >= 0; i--) {
                group[i] = (char) (OFFSET + (int) (word % BASE));
                word /= BASE;
            }
            out.append(group, 0, n + 1);
        }
        return out.toString();
    }

    /**
     * Decodes text produced by {@link #encode(byte[])}.
     *
     * <p>
     * Whitespace is ignored. A trailing group of {@code k} characters ({@code 2 <= k <= 4}) yields
     * {@code k - 1} bytes.
     * </p>
     *
     * @param text encoded text
     * @return decoded bytes
     * @throws IllegalArgumentException if the text contains a character outside the alphabet, a
     *         {@code 'z'} inside a group, a group that overflows 32 bits, or a one-character tail
     */
    public static byte[] decode(String text) {
        Preconditions.checkNotNull(text, "text must not be null");
        ByteArrayOutputStream out = new ByteArrayOutputStream(text.length() * 4 / 5 + 4);
        long word = 0;
        int count = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            if (c == ZERO_GROUP) {
                Preconditions.checkArgument(count == 0,
                        "'z' inside a group at index %s", i);
                out.write(0);
                out.write(0);
                out.write(0);
                out.write(0);
                continue;
            }
            Preconditions.checkArgument(c >= OFFSET && c <= 'u',
                    "Illegal ASCII85 character '%s' at index %s", c, i);
            word = word * BASE + (c - OFFSET);
            count++;
            if (count == 5) {
                writeWord(out, word, 4);
                word = 0;
                count = 0;
            }
        }

        if (count > 0) {
            Preconditions.checkArgument(count > 1, "Truncated ASCII85 group of one character");
            for (int i = count; i < 5; i++) {
                word = word * BASE + ('u' - OFFSET);
            }
            writeWord(out, word, count - 1);
        }
        return out.toByteArray();
    }

    private static void writeWord(ByteArrayOutputStream out, long word, int bytes) {
        Preconditions.checkArgument(word <= 0xFFFFFFFFL, "ASCII85 group overflows 32 bits");
        for (int i = 0; i < bytes; i++) {
            out.write((int) (word >>> (24 - 8 * i)) & 0xFF);
        }
    }
}
