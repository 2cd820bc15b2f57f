package io.powledger.core.protocol;

import java.util.List;

/**
 * Block = header + ordered transactions + the stored header hash.
 * The stored hash is whatever the block was sealed with; validators recompute it.
 */
public final class Block {
    private final BlockHeader header;
    private final List<Transaction> transactions;
    private final String hash;

    public Block(BlockHeader header, List<Transaction> txs, String hash) {
        if (header == null) throw new IllegalArgumentException("missing header");
        this.header = header;
        this.transactions = txs != null ? List.copyOf(txs) : List.of();
        this.hash = hash != null ? hash : "";
    }

    /** Block sealed with its current header hash. */
    public static Block sealed(BlockHeader header, List<Transaction> txs) {
        return new Block(header, txs, header.hash());
    }

    public BlockHeader header() { return header; }
    public List<Transaction> transactions() { return transactions; }
    public String hash() { return hash; }

    public long index() { return header.index(); }
    public String previousHash() { return header.previousHash(); }
    public String merkleRoot() { return header.merkleRoot(); }
    public String timestamp() { return header.timestamp(); }
    public long nonce() { return header.nonce(); }

    /** Recomputes the Merkle root from the transactions (the header copy is not re-derived). */
    public String computeMerkleRoot() {
        return Merkle.rootOfTransactions(transactions);
    }

    /** Copy with a different nonce that keeps the old stored hash, as a tampered block would. */
    public Block withNonce(long nonce) {
        return new Block(header.withNonce(nonce), transactions, hash);
    }

    @Override public String toString() {
        return "Block{index=" + header.index() + ", txs=" + transactions.size() + "}";
    }
}
