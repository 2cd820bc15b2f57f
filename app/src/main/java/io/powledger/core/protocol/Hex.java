package io.powledger.core.protocol;

/**
 * Lowercase hex helpers plus the byte-order flips used by txids and Merkle roots
 * (ids are displayed big-endian, hashed little-endian).
 */
public final class Hex {
    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private Hex() {}

    public static String encode(byte[] b) {
        char[] out = new char[b.length * 2];
        for (int i = 0, j = 0; i < b.length; i++) {
            int v = b[i] & 0xff;
            out[j++] = DIGITS[v >>> 4];
            out[j++] = DIGITS[v & 0x0f];
        }
        return new String(out);
    }

    public static byte[] decode(String hex) {
        if (hex == null || hex.isEmpty()) {
            return new byte[0];
        }
        if (hex.length() % 2 != 0) {
            throw new IllegalArgumentException("hex string must have an even length: " + hex.length());
        }
        int len = hex.length();
        byte[] out = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int hi = Character.digit(hex.charAt(i), 16);
            int lo = Character.digit(hex.charAt(i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("not a hex string: " + hex);
            }
            out[i / 2] = (byte) ((hi << 4) + lo);
        }
        return out;
    }

    public static byte[] reverse(byte[] in) {
        byte[] out = new byte[in.length];
        for (int i = 0; i < in.length; i++) {
            out[i] = in[in.length - 1 - i];
        }
        return out;
    }

    /** Big-endian display hex to little-endian bytes. */
    public static byte[] decodeReversed(String hex) {
        return reverse(decode(hex));
    }

    /** Little-endian bytes to big-endian display hex. */
    public static String encodeReversed(byte[] bytes) {
        return encode(reverse(bytes));
    }
}
