package io.powledger.core.protocol;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Header fields covered by proof-of-work.
 * - index: position in the chain (genesis = 0)
 * - timestamp: ISO-8601 UTC with millisecond precision, captured when the block is assembled
 * - previousHash: header hash of the parent, "0" for genesis
 * - merkleRoot: commitment to the block's txids
 * - nonce: the search variable
 * The hash is SHA-256 over {@code index|timestamp|previousHash|merkleRoot|nonce}.
 */
public final class BlockHeader {
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final long index;
    private final String timestamp;
    private final String previousHash;
    private final String merkleRoot;
    private final long nonce;

    public BlockHeader(long index, String timestamp, String previousHash, String merkleRoot, long nonce) {
        this.index = index;
        this.timestamp = timestamp != null ? timestamp : "";
        this.previousHash = previousHash != null ? previousHash : "";
        this.merkleRoot = merkleRoot != null ? merkleRoot : "";
        this.nonce = nonce;
    }

    public static String formatTimestamp(Instant instant) {
        return TIMESTAMP.format(instant);
    }

    public long index() { return index; }
    public String timestamp() { return timestamp; }
    public String previousHash() { return previousHash; }
    public String merkleRoot() { return merkleRoot; }
    public long nonce() { return nonce; }

    public BlockHeader withNonce(long n) {
        return new BlockHeader(index, timestamp, previousHash, merkleRoot, n);
    }

    /** Pipe-joined header string; the only input to the header hash. */
    public String canonical() {
        return canonical(index, timestamp, previousHash, merkleRoot, nonce);
    }

    public static String canonical(long index, String timestamp, String previousHash, String merkleRoot, long nonce) {
        return index + "|" + timestamp + "|" + previousHash + "|" + merkleRoot + "|" + nonce;
    }

    public String hash() {
        return Hashes.sha256Hex(canonical());
    }

    @Override public String toString() {
        return "BlockHeader{index=" + index + ", nonce=" + nonce + "}";
    }
}
