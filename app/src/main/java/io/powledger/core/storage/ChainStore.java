package io.powledger.core.storage;

import io.powledger.core.protocol.Block;

import java.util.List;
import java.util.Optional;

/**
 * Append-only block sequence. Position equals block index on a well-formed chain.
 */
public interface ChainStore {

    /** Append a block after the current head. */
    void append(Block block);

    /** Block at a given position. */
    Optional<Block> getBlock(long position);

    /** Most recently appended block, if any. */
    Optional<Block> getHead();

    /** Number of blocks stored. */
    long size();

    /** Snapshot of all blocks, genesis first. */
    List<Block> getBlocksInOrder();
}
