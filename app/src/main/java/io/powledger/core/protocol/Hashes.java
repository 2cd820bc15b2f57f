package io.powledger.core.protocol;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    private Hashes(){}

    public static byte[] sha256(byte[] in){
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Hash-of-hash, as used for txids and Merkle nodes. */
    public static byte[] doubleSha256(byte[] in) {
        return sha256(sha256(in));
    }

    /** SHA-256 of the UTF-8 bytes of {@code text}, as lowercase hex. */
    public static String sha256Hex(String text) {
        return Hex.encode(sha256(text.getBytes(StandardCharsets.UTF_8)));
    }
}
