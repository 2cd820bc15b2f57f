package io.powledger.core.consensus;

import io.powledger.core.protocol.Block;

/**
 * Normalized view of one block as the validator sees it. Live blocks and imported
 * file records are both reduced to this shape.
 */
public record ChainRecord(long index, String timestamp, String previousHash, String merkleRoot, String hash, long nonce) {

    public ChainRecord {
        timestamp = timestamp != null ? timestamp : "";
        previousHash = previousHash != null ? previousHash : "";
        merkleRoot = merkleRoot != null ? merkleRoot : "";
        hash = hash != null ? hash : "";
    }

    public static ChainRecord of(Block block) {
        return new ChainRecord(block.index(), block.timestamp(), block.previousHash(),
                block.merkleRoot(), block.hash(), block.nonce());
    }
}
