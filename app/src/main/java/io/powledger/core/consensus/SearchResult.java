package io.powledger.core.consensus;

import io.powledger.core.protocol.BlockHeader;

import java.util.Optional;

/** Outcome of a nonce search: either a header that meets the target, or exhausted. */
public final class SearchResult {
    private final BlockHeader header;
    private final String hash;
    private final long attempts;

    private SearchResult(BlockHeader header, String hash, long attempts) {
        this.header = header;
        this.hash = hash;
        this.attempts = attempts;
    }

    static SearchResult found(BlockHeader header, String hash, long attempts) {
        return new SearchResult(header, hash, attempts);
    }

    static SearchResult exhausted(long attempts) {
        return new SearchResult(null, null, attempts);
    }

    public boolean isFound() { return header != null; }
    public Optional<BlockHeader> header() { return Optional.ofNullable(header); }
    public long nonce() { return header != null ? header.nonce() : -1L; }
    public String hash() { return hash; }
    public long attempts() { return attempts; }

    @Override public String toString() {
        return isFound()
                ? "SearchResult{found nonce=" + header.nonce() + ", attempts=" + attempts + "}"
                : "SearchResult{exhausted after " + attempts + "}";
    }
}
